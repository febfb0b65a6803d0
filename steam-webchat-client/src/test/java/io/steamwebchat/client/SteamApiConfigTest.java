package io.steamwebchat.client;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SteamApiConfigTest {

    @Test
    void defaultsMatchPublicEndpoint() {
        SteamApiConfig config = SteamApiConfig.defaults();

        assertThat(config.host()).isEqualTo("api.steampowered.com");
        assertThat(config.port()).isEqualTo(443);
        assertThat(config.clientId()).isEqualTo("DE45CD61");
        assertThat(config.userAgent()).isEqualTo("Steam 1291812 / iPhone");
        assertThat(config.pollTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.summariesBatchSize()).isEqualTo(100);
        assertThat(config.maxRelogonAttempts()).isEqualTo(3);
    }

    @Test
    void readsProperties() {
        Properties properties = new Properties();
        properties.setProperty(SteamApiConfig.KEY_HOST, " localhost ");
        properties.setProperty(SteamApiConfig.KEY_PORT, "8443");
        properties.setProperty(SteamApiConfig.KEY_POLL_TIMEOUT_SECONDS, "20");
        properties.setProperty(SteamApiConfig.KEY_SUMMARIES_BATCH_SIZE, "50");
        properties.setProperty(SteamApiConfig.KEY_MAX_RELOGON_ATTEMPTS, "0");

        SteamApiConfig config = SteamApiConfig.fromProperties(properties);

        assertThat(config.host()).isEqualTo("localhost");
        assertThat(config.port()).isEqualTo(8443);
        assertThat(config.pollTimeout()).isEqualTo(Duration.ofSeconds(20));
        assertThat(config.summariesBatchSize()).isEqualTo(50);
        assertThat(config.maxRelogonAttempts()).isZero();
        assertThat(config.clientId()).isEqualTo("DE45CD61");
    }

    @Test
    void rejectsInvalidNumbers() {
        Properties properties = new Properties();
        properties.setProperty(SteamApiConfig.KEY_PORT, "https");

        assertThatThrownBy(() -> SteamApiConfig.fromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(SteamApiConfig.KEY_PORT);
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThatThrownBy(() -> SteamApiConfig.builder().port(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SteamApiConfig.builder().summariesBatchSize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SteamApiConfig.builder().pollTimeout(Duration.ZERO)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SteamApiConfig.builder().host(" ")).isInstanceOf(IllegalArgumentException.class);
    }
}

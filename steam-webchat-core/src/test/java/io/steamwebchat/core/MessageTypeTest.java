package io.steamwebchat.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageTypeTest {

    @Test
    void fromWireNameIgnoresCase() {
        assertThat(MessageType.fromWireName("SayText")).contains(MessageType.SAY_TEXT);
        assertThat(MessageType.fromWireName("PERSONASTATE")).contains(MessageType.STATE);
        assertThat(MessageType.fromWireName("personarelationship")).contains(MessageType.RELATIONSHIP);
    }

    @Test
    void fromWireNameRejectsUnknownAndNull() {
        assertThat(MessageType.fromWireName("my_own_event")).isEmpty();
        assertThat(MessageType.fromWireName(null)).isEmpty();
    }

    @Test
    void wireNamesMatchProtocol() {
        assertThat(MessageType.LEFT_CONVERSATION.wireName()).isEqualTo("leftconversation");
        assertThat(MessageType.TYPING.wireName()).isEqualTo("typing");
        assertThat(MessageType.EMOTE.wireName()).isEqualTo("emote");
    }
}

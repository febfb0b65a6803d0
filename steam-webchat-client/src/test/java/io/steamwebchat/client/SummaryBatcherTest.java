package io.steamwebchat.client;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SummaryBatcherTest {

    private static List<String> ids(int count) {
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            ids.add(Integer.toString(i));
        }
        return ids;
    }

    @Test
    void issuesCeilingOfSizeOverBatchRequests() {
        for (int n : new int[] {1, 99, 100, 101, 200, 201, 1000}) {
            List<String> input = ids(n);
            List<String> batches = SummaryBatcher.batches(input, 100);

            assertThat(batches).hasSize((n + 99) / 100);
            List<String> rejoined = new ArrayList<>();
            for (String batch : batches) {
                List<String> chunk = Arrays.asList(batch.split(","));
                assertThat(chunk).hasSizeLessThanOrEqualTo(100);
                rejoined.addAll(chunk);
            }
            assertThat(rejoined).isEqualTo(input);
        }
    }

    @Test
    void exactMultipleLeavesNoTrailingEmptyBatch() {
        assertThat(SummaryBatcher.batches(List.of("a", "b", "c", "d"), 2)).containsExactly("a,b", "c,d");
    }

    @Test
    void nullAndEmptyInputProduceNoBatches() {
        assertThat(SummaryBatcher.batches(null, 100)).isEmpty();
        assertThat(SummaryBatcher.batches(List.of(), 100)).isEmpty();
    }

    @Test
    void blankIdsAreSkipped() {
        assertThat(SummaryBatcher.batches(Arrays.asList("a", null, " ", "b"), 100)).containsExactly("a,b");
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThatThrownBy(() -> SummaryBatcher.batches(List.of("a"), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

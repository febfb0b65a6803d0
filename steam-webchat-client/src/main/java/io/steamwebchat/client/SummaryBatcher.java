package io.steamwebchat.client;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits id lists into comma-joined chunks the summaries endpoint accepts.
 */
final class SummaryBatcher {

    static final String SEPARATOR = ",";

    private SummaryBatcher() {}

    /**
     * Partitions {@code ids} into contiguous chunks of at most {@code batchSize} ids, preserving
     * order. Null and blank ids are skipped.
     *
     * @return one joined string per chunk, empty when there is nothing to request
     */
    static List<String> batches(List<String> ids, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }

        List<String> batches = new ArrayList<>();
        StringBuilder chunk = new StringBuilder();
        int inChunk = 0;
        for (String id : ids) {
            if (id == null || id.isBlank()) continue;
            if (inChunk == batchSize) {
                batches.add(chunk.toString());
                chunk.setLength(0);
                inChunk = 0;
            }
            if (inChunk > 0) chunk.append(SEPARATOR);
            chunk.append(id);
            inChunk++;
        }
        if (inChunk > 0) {
            batches.add(chunk.toString());
        }
        return batches;
    }
}

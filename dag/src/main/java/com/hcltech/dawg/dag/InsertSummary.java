package com.hcltech.dawg.dag;

import java.util.List;

/**
 * Outcome of a batch insert.
 *
 * @param accepted   words that were new members
 * @param duplicates well formed words that were already members
 * @param rejected   one message per malformed word, prefixed by its position in the batch
 */
public record InsertSummary(int accepted, int duplicates, List<String> rejected) {
    public InsertSummary {
        rejected = List.copyOf(rejected);
    }

    public int total() {
        return accepted + duplicates + rejected.size();
    }

    public boolean hasRejections() {
        return !rejected.isEmpty();
    }
}

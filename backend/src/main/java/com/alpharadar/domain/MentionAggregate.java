package com.alpharadar.domain;

/**
 * Per (contract, chain) totals over a time window: mention count and distinct source count.
 */
public record MentionAggregate(String contract, Chain chain, int mentionCount, int uniqueSources) {

    public boolean meets(int minMentions, int minUniqueSources) {
        return mentionCount >= minMentions && uniqueSources >= minUniqueSources;
    }
}

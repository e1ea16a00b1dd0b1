package com.alpharadar.trending;

import java.util.Comparator;

/**
 * Velocity, composite score and ranking order for trending tokens.
 */
public final class TrendingScoring {

    public static final int MENTION_WEIGHT = 2;
    public static final int SOURCE_WEIGHT = 3;
    public static final int VELOCITY_WEIGHT = 5;

    /** Score desc, then mentionCount desc, then contract asc. Total order for distinct contracts. */
    public static final Comparator<TrendingToken> RANKING = Comparator
            .comparingDouble(TrendingToken::getScore).reversed()
            .thenComparing(Comparator.comparingInt(TrendingToken::getMentionCount).reversed())
            .thenComparing(TrendingToken::getContract);

    private TrendingScoring() {
    }

    /**
     * (current - prior) / prior; with no prior mentions the whole current count is treated as growth.
     */
    public static double velocity(long current, long prior) {
        if (prior == 0) {
            return current;
        }
        return (double) (current - prior) / prior;
    }

    public static double score(int mentionCount, int uniqueSources, double velocity) {
        return mentionCount * MENTION_WEIGHT + uniqueSources * SOURCE_WEIGHT + velocity * VELOCITY_WEIGHT;
    }
}

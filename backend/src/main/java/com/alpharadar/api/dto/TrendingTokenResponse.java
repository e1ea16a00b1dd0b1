package com.alpharadar.api.dto;

import com.alpharadar.trending.TrendingToken;

public record TrendingTokenResponse(
        String contract,
        String chain,
        int mentionCount,
        int uniqueSources,
        double velocity,
        boolean newThisWindow,
        double score
) {

    public static TrendingTokenResponse from(TrendingToken t) {
        return new TrendingTokenResponse(t.getContract(), t.getChain().key(), t.getMentionCount(),
                t.getUniqueSources(), t.getVelocity(), t.isNewThisWindow(), t.getScore());
    }
}

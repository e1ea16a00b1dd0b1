package com.alpharadar.trending;

import com.alpharadar.domain.Chain;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A contract that crossed the trending thresholds in the current window. Built fresh on every detection,
 * never persisted.
 */
@Getter
@Setter
@NoArgsConstructor
public class TrendingToken {

    private String contract;
    private Chain chain;
    private int mentionCount;
    private int uniqueSources;
    /** Relative change against the previous window; equals mentionCount when the previous window was empty. */
    private double velocity;
    /** True when the previous window had no mentions of this contract. */
    private boolean newThisWindow;
    private double score;

    public TrendingToken(String contract, Chain chain, int mentionCount, int uniqueSources, double velocity, double score) {
        this.contract = contract;
        this.chain = chain;
        this.mentionCount = mentionCount;
        this.uniqueSources = uniqueSources;
        this.velocity = velocity;
        this.score = score;
    }

    @Override
    public String toString() {
        return chain + ":" + contract + " score=" + score + " mentions=" + mentionCount
                + " sources=" + uniqueSources + " velocity=" + velocity + (newThisWindow ? " new" : "");
    }
}

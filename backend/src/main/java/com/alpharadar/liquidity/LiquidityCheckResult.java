package com.alpharadar.liquidity;

import lombok.Getter;

/**
 * Outcome of a liquidity lookup: PASS, REJECT (all known pairs below the floor) or UNAVAILABLE
 * (timeout, HTTP error, unparsable body, throttled). Only REJECT removes a token from trending.
 */
@Getter
public class LiquidityCheckResult {

    public enum Verdict {
        PASS,
        REJECT,
        UNAVAILABLE
    }

    private final Verdict verdict;
    /** Highest pair liquidity seen, 0 when no pairs or unknown. */
    private final double maxLiquidityUsd;
    private final int pairCount;
    private final String reason;

    private LiquidityCheckResult(Verdict verdict, double maxLiquidityUsd, int pairCount, String reason) {
        this.verdict = verdict;
        this.maxLiquidityUsd = maxLiquidityUsd;
        this.pairCount = pairCount;
        this.reason = reason;
    }

    public static LiquidityCheckResult pass(double maxLiquidityUsd, int pairCount) {
        return new LiquidityCheckResult(Verdict.PASS, maxLiquidityUsd, pairCount, null);
    }

    public static LiquidityCheckResult reject(double maxLiquidityUsd, int pairCount) {
        return new LiquidityCheckResult(Verdict.REJECT, maxLiquidityUsd, pairCount, null);
    }

    public static LiquidityCheckResult unavailable(String reason) {
        return new LiquidityCheckResult(Verdict.UNAVAILABLE, 0d, 0, reason);
    }

    /** Fail-open collapse: everything except REJECT keeps the token. */
    public boolean isAcceptable() {
        return verdict != Verdict.REJECT;
    }

    public boolean isUnavailable() {
        return verdict == Verdict.UNAVAILABLE;
    }

    @Override
    public String toString() {
        return verdict + (reason != null ? "(" + reason + ")" : "(max=" + maxLiquidityUsd + ", pairs=" + pairCount + ")");
    }
}

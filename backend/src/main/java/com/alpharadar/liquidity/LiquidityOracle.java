package com.alpharadar.liquidity;

import com.alpharadar.domain.Chain;

/**
 * Answers whether a contract has enough DEX liquidity to be worth alerting on.
 */
public interface LiquidityOracle {

    /** Never throws for remote failures; those come back as {@link LiquidityCheckResult.Verdict#UNAVAILABLE}. */
    LiquidityCheckResult check(String contract, Chain chain);

    default boolean checkLiquidity(String contract, Chain chain) {
        return check(contract, chain).isAcceptable();
    }
}

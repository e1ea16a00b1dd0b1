package com.alpharadar.liquidity.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Liquidity filter configuration. Documented in application.yml under alpharadar.liquidity.
 */
@ConfigurationProperties(prefix = "alpharadar.liquidity")
@Getter
@Setter
public class LiquidityProperties {

    /**
     * When false the trending engine never calls the oracle.
     */
    private boolean enabled = false;

    /**
     * A token passes if any of its pairs reports at least this much USD liquidity.
     */
    private double minLiquidityUsd = 1000d;

    /**
     * Dexscreener token endpoint; the contract address is appended as the last path segment.
     */
    private String apiBaseUrl = "https://api.dexscreener.com/latest/dex/tokens";

    /**
     * Client timeout per lookup. The engine waits at most twice this before failing open.
     */
    private Duration timeout = Duration.ofSeconds(5);

    /**
     * Dexscreener allows roughly 300 token lookups per minute.
     */
    private int requestsPerMinute = 300;

    /**
     * Pool size of liquidity-executor.
     */
    private int maxConcurrentChecks = 4;
}

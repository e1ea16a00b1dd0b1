package com.alpharadar.trending.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Trending thresholds and cadence. Documented in application.yml under alpharadar.trending.
 */
@ConfigurationProperties(prefix = "alpharadar.trending")
@Getter
@Setter
public class TrendingProperties {

    /**
     * Sliding window length; velocity compares against the window immediately before it.
     */
    private int windowMinutes = 5;

    /**
     * Minimum mentions inside the window.
     */
    private int minMentions = 3;

    /**
     * Minimum distinct sources inside the window.
     */
    private int minUniqueSources = 2;

    /**
     * Fixed delay between detection cycles.
     */
    private long checkIntervalMs = 30_000L;
}

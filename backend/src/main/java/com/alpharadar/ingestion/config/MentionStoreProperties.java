package com.alpharadar.ingestion.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Mention log settings. Documented in application.yml under alpharadar.mentions.
 */
@ConfigurationProperties(prefix = "alpharadar.mentions")
@Getter
@Setter
public class MentionStoreProperties {

    /**
     * Mentions older than this are deleted by the retention job. Must exceed twice the trending window.
     */
    private int retentionHours = 24;

    /**
     * Retention job period in milliseconds.
     */
    private long purgeIntervalMs = 3_600_000L;

    /**
     * Server-side max time applied to window aggregation and range counts.
     */
    private Duration queryTimeout = Duration.ofSeconds(10);
}

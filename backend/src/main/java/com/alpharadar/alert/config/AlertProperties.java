package com.alpharadar.alert.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Alerting configuration. Documented in application.yml under alpharadar.alert.
 */
@ConfigurationProperties(prefix = "alpharadar.alert")
@Getter
@Setter
public class AlertProperties {

    /**
     * Minimum minutes between two alerts for the same contract.
     */
    private int cooldownMinutes = 15;

    /**
     * Remove expired cooldown entries at the end of every detection cycle.
     */
    private boolean sweepEachCycle = true;
}

package com.alpharadar.alert.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Alert module configuration.
 */
@Configuration
@EnableConfigurationProperties(AlertProperties.class)
public class AlertConfig {
}

package com.alpharadar.trending.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Trending module configuration.
 */
@Configuration
@EnableConfigurationProperties(TrendingProperties.class)
public class TrendingConfig {
}

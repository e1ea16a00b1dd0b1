package com.alpharadar.ingestion.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Ingestion module configuration.
 */
@Configuration
@EnableConfigurationProperties(MentionStoreProperties.class)
public class MentionStoreConfig {
}

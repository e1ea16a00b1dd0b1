package com.alpharadar.liquidity.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Liquidity module configuration: properties and the Dexscreener rate limiter.
 */
@Configuration
@EnableConfigurationProperties(LiquidityProperties.class)
public class LiquidityConfig {

    public static final String DEXSCREENER_RATE_LIMITER = "dexscreenerRateLimiter";

    @Bean(name = DEXSCREENER_RATE_LIMITER)
    public RateLimiter dexscreenerRateLimiter(LiquidityProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .limitForPeriod(Math.max(1, properties.getRequestsPerMinute()))
                .timeoutDuration(properties.getTimeout())
                .build();
        return RateLimiter.of(DEXSCREENER_RATE_LIMITER, config);
    }
}

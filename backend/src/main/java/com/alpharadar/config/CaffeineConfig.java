package com.alpharadar.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * Caffeine in-process caches.
 */
@Configuration
@EnableCaching
public class CaffeineConfig {

    /** Conclusive liquidity verdicts per contract. Short TTL: pools get added and drained quickly. */
    public static final String LIQUIDITY_CACHE = "liquidityCache";
    /** Token display names for alerts. Names rarely change, so a day is fine. */
    public static final String TOKEN_META_CACHE = "tokenMetaCache";

    @Bean
    public CacheManager caffeineCacheManager() {
        CaffeineCacheManager manager = new CaffeineCacheManager();
        manager.registerCustomCache(LIQUIDITY_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(60, TimeUnit.SECONDS)
                .maximumSize(5_000)
                .build());
        manager.registerCustomCache(TOKEN_META_CACHE, Caffeine.newBuilder()
                .expireAfterWrite(24, TimeUnit.HOURS)
                .maximumSize(5_000)
                .build());
        return manager;
    }
}

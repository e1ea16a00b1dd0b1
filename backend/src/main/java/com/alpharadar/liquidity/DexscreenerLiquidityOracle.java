package com.alpharadar.liquidity;

import com.alpharadar.config.CaffeineConfig;
import com.alpharadar.domain.Chain;
import com.alpharadar.liquidity.config.LiquidityConfig;
import com.alpharadar.liquidity.config.LiquidityProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

/**
 * Liquidity lookup via Dexscreener GET {apiBaseUrl}/{contract}. A token with no known pairs passes (too new to
 * be listed); otherwise it passes when any pair reports liquidity.usd at or above the floor.
 * Conclusive verdicts are cached briefly; UNAVAILABLE is never cached.
 */
@Component
@Slf4j
public class DexscreenerLiquidityOracle implements LiquidityOracle {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LiquidityProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;

    public DexscreenerLiquidityOracle(LiquidityProperties properties,
                                      WebClient.Builder webClientBuilder,
                                      @Qualifier(LiquidityConfig.DEXSCREENER_RATE_LIMITER) RateLimiter rateLimiter) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
    }

    @Override
    @Cacheable(cacheNames = CaffeineConfig.LIQUIDITY_CACHE, key = "#contract", unless = "#result.unavailable")
    public LiquidityCheckResult check(String contract, Chain chain) {
        if (!rateLimiter.acquirePermission()) {
            log.warn("Dexscreener rate limit reached, skipping liquidity check for {} ({})", contract, chain);
            return LiquidityCheckResult.unavailable("rate limited");
        }
        String url = properties.getApiBaseUrl() + "/" + contract;
        try {
            String body = webClientBuilder.build().get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getTimeout())
                    .block();
            LiquidityCheckResult result = parse(body, properties.getMinLiquidityUsd());
            if (result.isUnavailable()) {
                log.warn("Unparsable Dexscreener response for {} ({})", contract, chain);
            } else {
                log.debug("Liquidity {} for {} ({})", result, contract, chain);
            }
            return result;
        } catch (WebClientResponseException e) {
            log.warn("Dexscreener returned {} for {} ({}), failing open", e.getStatusCode().value(), contract, chain);
            return LiquidityCheckResult.unavailable("http " + e.getStatusCode().value());
        } catch (Exception e) {
            log.warn("Dexscreener lookup failed for {} ({}), failing open: {}", contract, chain, e.toString());
            return LiquidityCheckResult.unavailable(e.getClass().getSimpleName());
        }
    }

    /**
     * Null or empty pairs is PASS. A non-numeric liquidity.usd counts as zero for that pair.
     */
    static LiquidityCheckResult parse(String json, double minLiquidityUsd) {
        if (json == null || json.isBlank()) {
            return LiquidityCheckResult.unavailable("empty body");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            return LiquidityCheckResult.unavailable("malformed json");
        }
        if (root == null || !root.isObject()) {
            return LiquidityCheckResult.unavailable("unexpected body");
        }
        JsonNode pairs = root.path("pairs");
        if (!pairs.isArray() || pairs.isEmpty()) {
            return LiquidityCheckResult.pass(0d, 0);
        }
        double max = 0d;
        for (JsonNode pair : pairs) {
            JsonNode usd = pair.path("liquidity").path("usd");
            double value = usd.isNumber() ? usd.doubleValue() : 0d;
            max = Math.max(max, value);
        }
        return max >= minLiquidityUsd
                ? LiquidityCheckResult.pass(max, pairs.size())
                : LiquidityCheckResult.reject(max, pairs.size());
    }
}

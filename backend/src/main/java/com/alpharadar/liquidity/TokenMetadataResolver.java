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

/**
 * Token display name from the same Dexscreener token endpoint the liquidity check uses, read from the first
 * pair's baseToken. Never fails: any problem yields an empty string and the alert goes out without a name.
 * Only resolved names are cached.
 */
@Component
@Slf4j
public class TokenMetadataResolver {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final LiquidityProperties properties;
    private final WebClient.Builder webClientBuilder;
    private final RateLimiter rateLimiter;

    public TokenMetadataResolver(LiquidityProperties properties,
                                 WebClient.Builder webClientBuilder,
                                 @Qualifier(LiquidityConfig.DEXSCREENER_RATE_LIMITER) RateLimiter rateLimiter) {
        this.properties = properties;
        this.webClientBuilder = webClientBuilder;
        this.rateLimiter = rateLimiter;
    }

    /**
     * @return "Name (SYMBOL)", whichever of the two is present, or "" when unknown
     */
    @Cacheable(cacheNames = CaffeineConfig.TOKEN_META_CACHE, key = "#contract", unless = "#result.isEmpty()")
    public String displayName(String contract, Chain chain) {
        if (!rateLimiter.acquirePermission()) {
            log.debug("Dexscreener rate limit reached, no token name for {} ({})", contract, chain);
            return "";
        }
        try {
            String body = webClientBuilder.build().get()
                    .uri(properties.getApiBaseUrl() + "/" + contract)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(properties.getTimeout())
                    .block();
            return parseDisplayName(body);
        } catch (Exception e) {
            log.debug("Token name lookup failed for {} ({}): {}", contract, chain, e.toString());
            return "";
        }
    }

    static String parseDisplayName(String json) {
        if (json == null || json.isBlank()) {
            return "";
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (Exception e) {
            return "";
        }
        JsonNode pairs = root == null ? null : root.path("pairs");
        if (pairs == null || !pairs.isArray() || pairs.isEmpty()) {
            return "";
        }
        JsonNode base = pairs.get(0).path("baseToken");
        String name = base.path("name").asText("").trim();
        String symbol = base.path("symbol").asText("").trim();
        if (!name.isEmpty() && !symbol.isEmpty()) {
            return name + " (" + symbol + ")";
        }
        return symbol.isEmpty() ? name : symbol;
    }
}

package com.alpharadar.alert;

import com.alpharadar.liquidity.TokenMetadataResolver;
import com.alpharadar.trending.TrendingToken;
import com.alpharadar.trending.config.TrendingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Dry-run dispatcher: writes the alert to the log instead of a chat transport.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LoggingAlertDispatcher implements AlertDispatcher {

    private final TrendingProperties trendingProperties;
    private final TokenMetadataResolver tokenMetadataResolver;

    @Override
    public void dispatch(TrendingToken token) {
        String name = tokenMetadataResolver.displayName(token.getContract(), token.getChain());
        log.info("[DRY RUN] Alert:\n{}", AlertMessageFormatter.format(token, trendingProperties.getWindowMinutes(), name));
    }
}

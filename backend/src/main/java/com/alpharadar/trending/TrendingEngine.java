package com.alpharadar.trending;

import com.alpharadar.config.AsyncConfig;
import com.alpharadar.domain.Chain;
import com.alpharadar.domain.MentionAggregate;
import com.alpharadar.ingestion.store.MentionStore;
import com.alpharadar.liquidity.LiquidityCheckResult;
import com.alpharadar.liquidity.LiquidityOracle;
import com.alpharadar.liquidity.config.LiquidityProperties;
import com.alpharadar.trending.config.TrendingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Turns the mention log into a ranked list of trending tokens.
 * <p>
 * For the window [now - window, now) every (contract, chain) meeting both thresholds is scored from its mention
 * count, distinct sources and velocity against the preceding window of equal length. With the liquidity filter
 * on, tokens the oracle rejects are dropped; oracle failures keep the token. The engine is stateless between
 * calls and knows nothing about cooldowns.
 * <p>
 * Store failures propagate as {@link com.alpharadar.ingestion.store.MentionStoreException}; no partial list is
 * returned.
 */
@Service
@Slf4j
public class TrendingEngine {

    private static final int LOG_TOP = 5;

    private final MentionStore mentionStore;
    private final LiquidityOracle liquidityOracle;
    private final Executor liquidityExecutor;
    private final Clock clock;
    private final Duration window;
    private final int minMentions;
    private final int minUniqueSources;
    private final boolean liquidityEnabled;
    private final long liquidityGuardMillis;

    public TrendingEngine(MentionStore mentionStore,
                          LiquidityOracle liquidityOracle,
                          @Qualifier(AsyncConfig.LIQUIDITY_EXECUTOR) Executor liquidityExecutor,
                          TrendingProperties trendingProperties,
                          LiquidityProperties liquidityProperties,
                          Clock clock) {
        if (trendingProperties.getWindowMinutes() <= 0) {
            throw new IllegalArgumentException("window-minutes must be positive: " + trendingProperties.getWindowMinutes());
        }
        if (trendingProperties.getMinMentions() < 1) {
            throw new IllegalArgumentException("min-mentions must be >= 1: " + trendingProperties.getMinMentions());
        }
        if (trendingProperties.getMinUniqueSources() < 1) {
            throw new IllegalArgumentException("min-unique-sources must be >= 1: " + trendingProperties.getMinUniqueSources());
        }
        if (liquidityProperties.getMinLiquidityUsd() < 0) {
            throw new IllegalArgumentException("min-liquidity-usd must be >= 0: " + liquidityProperties.getMinLiquidityUsd());
        }
        if (liquidityProperties.getTimeout() == null || liquidityProperties.getTimeout().isNegative()
                || liquidityProperties.getTimeout().isZero()) {
            throw new IllegalArgumentException("liquidity timeout must be positive");
        }
        this.mentionStore = mentionStore;
        this.liquidityOracle = liquidityOracle;
        this.liquidityExecutor = liquidityExecutor;
        this.clock = clock;
        this.window = Duration.ofMinutes(trendingProperties.getWindowMinutes());
        this.minMentions = trendingProperties.getMinMentions();
        this.minUniqueSources = trendingProperties.getMinUniqueSources();
        this.liquidityEnabled = liquidityProperties.isEnabled();
        // oracle has its own client timeout; this bound also covers rate-limiter wait and queueing
        this.liquidityGuardMillis = liquidityProperties.getTimeout().toMillis() * 2;
    }

    /** Trending tokens across all chains. */
    public List<TrendingToken> detect() {
        return detect(null);
    }

    /**
     * @param chain restrict to one chain; null for all chains
     * @return ranked tokens, possibly empty
     */
    public List<TrendingToken> detect(Chain chain) {
        Instant now = clock.instant();
        Instant windowStart = now.minus(window);
        Instant priorStart = windowStart.minus(window);

        List<MentionAggregate> groups = mentionStore.aggregateWindow(windowStart, chain, minMentions, minUniqueSources);
        List<TrendingToken> tokens = new ArrayList<>(groups.size());
        for (MentionAggregate group : groups) {
            if (!group.meets(minMentions, minUniqueSources)) {
                continue;
            }
            long prior = mentionStore.countInRange(group.contract(), priorStart, windowStart);
            double velocity = TrendingScoring.velocity(group.mentionCount(), prior);
            double score = TrendingScoring.score(group.mentionCount(), group.uniqueSources(), velocity);
            TrendingToken token = new TrendingToken(group.contract(), group.chain(), group.mentionCount(),
                    group.uniqueSources(), velocity, score);
            token.setNewThisWindow(prior == 0);
            tokens.add(token);
        }

        if (liquidityEnabled && !tokens.isEmpty()) {
            tokens = filterByLiquidity(tokens);
        }
        tokens.sort(TrendingScoring.RANKING);
        logTop(chain, tokens);
        return tokens;
    }

    /**
     * Runs {@link #detect(Chain)} for every chain. Chains with nothing trending are absent from the map.
     */
    public Map<Chain, List<TrendingToken>> detectByChain() {
        Map<Chain, List<TrendingToken>> result = new EnumMap<>(Chain.class);
        for (Chain chain : Chain.values()) {
            List<TrendingToken> tokens = detect(chain);
            if (!tokens.isEmpty()) {
                result.put(chain, Collections.unmodifiableList(tokens));
            }
        }
        return result;
    }

    private List<TrendingToken> filterByLiquidity(List<TrendingToken> tokens) {
        List<CompletableFuture<LiquidityCheckResult>> checks = new ArrayList<>(tokens.size());
        for (TrendingToken token : tokens) {
            checks.add(submitCheck(token));
        }
        List<TrendingToken> kept = new ArrayList<>(tokens.size());
        for (int i = 0; i < tokens.size(); i++) {
            TrendingToken token = tokens.get(i);
            LiquidityCheckResult result = checks.get(i).join();
            if (result.isUnavailable()) {
                log.warn("Liquidity unknown for {} ({}), keeping token: {}", token.getContract(), token.getChain(), result.getReason());
                kept.add(token);
            } else if (result.isAcceptable()) {
                kept.add(token);
            } else {
                log.info("Dropped {} ({}): liquidity ${} below floor", token.getContract(), token.getChain(),
                        result.getMaxLiquidityUsd());
            }
        }
        return kept;
    }

    private CompletableFuture<LiquidityCheckResult> submitCheck(TrendingToken token) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> liquidityOracle.check(token.getContract(), token.getChain()), liquidityExecutor)
                    .completeOnTimeout(LiquidityCheckResult.unavailable("timeout"), liquidityGuardMillis, TimeUnit.MILLISECONDS)
                    .exceptionally(ex -> LiquidityCheckResult.unavailable(ex.toString()));
        } catch (RejectedExecutionException e) {
            return CompletableFuture.completedFuture(LiquidityCheckResult.unavailable("executor saturated"));
        }
    }

    private void logTop(Chain chain, List<TrendingToken> tokens) {
        if (tokens.isEmpty()) {
            log.debug("No trending tokens for {}", chain != null ? chain : "all chains");
            return;
        }
        log.info("Trending {} for {}", tokens.size(), chain != null ? chain : "all chains");
        for (TrendingToken t : tokens.subList(0, Math.min(LOG_TOP, tokens.size()))) {
            log.info("  {} score={} mentions={} sources={} velocity={}",
                    t.getContract(), t.getScore(), t.getMentionCount(), t.getUniqueSources(), t.getVelocity());
        }
    }
}

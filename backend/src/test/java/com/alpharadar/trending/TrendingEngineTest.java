package com.alpharadar.trending;

import com.alpharadar.domain.Chain;
import com.alpharadar.domain.MentionAggregate;
import com.alpharadar.ingestion.store.MentionStore;
import com.alpharadar.ingestion.store.MentionStoreException;
import com.alpharadar.liquidity.LiquidityCheckResult;
import com.alpharadar.liquidity.LiquidityOracle;
import com.alpharadar.liquidity.config.LiquidityProperties;
import com.alpharadar.trending.config.TrendingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrendingEngineTest {

    private static final Instant NOW = Instant.parse("2025-01-15T12:00:00Z");
    private static final Instant WINDOW_START = Instant.parse("2025-01-15T11:55:00Z");
    private static final Instant PRIOR_START = Instant.parse("2025-01-15T11:50:00Z");
    private static final String TOKEN_A = "AAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAAA";
    private static final String TOKEN_B = "BBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBBB";

    @Mock
    private MentionStore mentionStore;
    @Mock
    private LiquidityOracle liquidityOracle;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private TrendingProperties trendingProperties;
    private LiquidityProperties liquidityProperties;

    @BeforeEach
    void setUp() {
        trendingProperties = new TrendingProperties();
        liquidityProperties = new LiquidityProperties();
    }

    private TrendingEngine engine() {
        return new TrendingEngine(mentionStore, liquidityOracle, Runnable::run, trendingProperties, liquidityProperties, clock);
    }

    private void stubScenarioAB(Chain chain) {
        when(mentionStore.aggregateWindow(eq(WINDOW_START), chain == null ? isNull() : eq(chain), eq(3), eq(2)))
                .thenReturn(List.of(
                        new MentionAggregate(TOKEN_A, Chain.SOLANA, 4, 3),
                        new MentionAggregate(TOKEN_B, Chain.SOLANA, 3, 2)));
        when(mentionStore.countInRange(TOKEN_A, PRIOR_START, WINDOW_START)).thenReturn(2L);
        when(mentionStore.countInRange(TOKEN_B, PRIOR_START, WINDOW_START)).thenReturn(0L);
    }

    @Test
    @DisplayName("accelerating newcomer outranks steadier token with more mentions")
    void detect_scenarioAB() {
        stubScenarioAB(null);

        List<TrendingToken> result = engine().detect();

        assertThat(result).extracting(TrendingToken::getContract).containsExactly(TOKEN_B, TOKEN_A);
        TrendingToken b = result.get(0);
        assertThat(b.getVelocity()).isEqualTo(3.0);
        assertThat(b.getScore()).isEqualTo(27.0);
        assertThat(b.isNewThisWindow()).isTrue();
        TrendingToken a = result.get(1);
        assertThat(a.getMentionCount()).isEqualTo(4);
        assertThat(a.getUniqueSources()).isEqualTo(3);
        assertThat(a.getVelocity()).isEqualTo(1.0);
        assertThat(a.getScore()).isEqualTo(22.0);
        assertThat(a.isNewThisWindow()).isFalse();
    }

    @Test
    @DisplayName("groups below either threshold are dropped even if the store returns them")
    void detect_refiltersThresholds() {
        when(mentionStore.aggregateWindow(eq(WINDOW_START), isNull(), eq(3), eq(2)))
                .thenReturn(List.of(
                        new MentionAggregate("single-source", Chain.SOLANA, 10, 1),
                        new MentionAggregate("too-quiet", Chain.EVM, 2, 2),
                        new MentionAggregate(TOKEN_A, Chain.SOLANA, 3, 2)));
        when(mentionStore.countInRange(TOKEN_A, PRIOR_START, WINDOW_START)).thenReturn(0L);

        List<TrendingToken> result = engine().detect();

        assertThat(result).extracting(TrendingToken::getContract).containsExactly(TOKEN_A);
        verify(mentionStore, never()).countInRange(eq("single-source"), any(), any());
        verify(mentionStore, never()).countInRange(eq("too-quiet"), any(), any());
    }

    @Test
    @DisplayName("empty window yields empty list without range queries")
    void detect_emptyWindow() {
        when(mentionStore.aggregateWindow(any(), isNull(), eq(3), eq(2))).thenReturn(List.of());

        assertThat(engine().detect()).isEmpty();
        verify(mentionStore, never()).countInRange(anyString(), any(), any());
    }

    @Test
    @DisplayName("chain filter is passed to the store")
    void detect_chainFilter() {
        stubScenarioAB(Chain.SOLANA);

        List<TrendingToken> result = engine().detect(Chain.SOLANA);

        assertThat(result).hasSize(2);
        verify(mentionStore).aggregateWindow(WINDOW_START, Chain.SOLANA, 3, 2);
    }

    @Test
    @DisplayName("window length follows configuration")
    void detect_customWindow() {
        trendingProperties.setWindowMinutes(10);
        Instant start = Instant.parse("2025-01-15T11:50:00Z");
        Instant priorStart = Instant.parse("2025-01-15T11:40:00Z");
        when(mentionStore.aggregateWindow(eq(start), isNull(), eq(3), eq(2)))
                .thenReturn(List.of(new MentionAggregate(TOKEN_A, Chain.SOLANA, 6, 3)));
        when(mentionStore.countInRange(TOKEN_A, priorStart, start)).thenReturn(3L);

        List<TrendingToken> result = engine().detect();

        assertThat(result).hasSize(1);
        assertThat(result.get(0).getVelocity()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("liquidity disabled never consults the oracle")
    void detect_liquidityDisabled() {
        stubScenarioAB(null);

        engine().detect();

        verifyNoInteractions(liquidityOracle);
    }

    @Test
    @DisplayName("token rejected by the oracle is dropped")
    void detect_liquidityReject() {
        liquidityProperties.setEnabled(true);
        stubScenarioAB(null);
        when(liquidityOracle.check(TOKEN_A, Chain.SOLANA)).thenReturn(LiquidityCheckResult.reject(200d, 1));
        when(liquidityOracle.check(TOKEN_B, Chain.SOLANA)).thenReturn(LiquidityCheckResult.pass(50_000d, 2));

        List<TrendingToken> result = engine().detect();

        assertThat(result).extracting(TrendingToken::getContract).containsExactly(TOKEN_B);
    }

    @Test
    @DisplayName("unavailable or failing oracle keeps the token")
    void detect_liquidityFailOpen() {
        liquidityProperties.setEnabled(true);
        stubScenarioAB(null);
        when(liquidityOracle.check(TOKEN_A, Chain.SOLANA)).thenThrow(new IllegalStateException("boom"));
        when(liquidityOracle.check(TOKEN_B, Chain.SOLANA)).thenReturn(LiquidityCheckResult.unavailable("http 503"));

        List<TrendingToken> result = engine().detect();

        assertThat(result).extracting(TrendingToken::getContract).containsExactly(TOKEN_B, TOKEN_A);
    }

    @Test
    @DisplayName("oracle call exceeding the guard resolves to keep")
    void detect_liquidityTimeout() {
        liquidityProperties.setEnabled(true);
        liquidityProperties.setTimeout(Duration.ofMillis(50));
        stubScenarioAB(null);
        when(liquidityOracle.check(TOKEN_A, Chain.SOLANA)).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return LiquidityCheckResult.reject(0d, 1);
        });
        when(liquidityOracle.check(TOKEN_B, Chain.SOLANA)).thenReturn(LiquidityCheckResult.pass(5_000d, 1));
        ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            TrendingEngine engine = new TrendingEngine(mentionStore, liquidityOracle, executor,
                    trendingProperties, liquidityProperties, clock);

            List<TrendingToken> result = engine.detect();

            assertThat(result).extracting(TrendingToken::getContract).containsExactly(TOKEN_B, TOKEN_A);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("store failure propagates and no list is returned")
    void detect_storeFailurePropagates() {
        when(mentionStore.aggregateWindow(any(), isNull(), eq(3), eq(2)))
                .thenThrow(new MentionStoreException("down", new RuntimeException("socket")));

        assertThatThrownBy(() -> engine().detect()).isInstanceOf(MentionStoreException.class);
    }

    @Test
    @DisplayName("detectByChain omits chains with nothing trending")
    void detectByChain_onlyNonEmptyChains() {
        String evm = "0x742d35cc6634c0532925a3b844bc454e4438f44e";
        when(mentionStore.aggregateWindow(WINDOW_START, Chain.SOLANA, 3, 2)).thenReturn(List.of());
        when(mentionStore.aggregateWindow(WINDOW_START, Chain.EVM, 3, 2))
                .thenReturn(List.of(new MentionAggregate(evm, Chain.EVM, 3, 2)));
        when(mentionStore.countInRange(evm, PRIOR_START, WINDOW_START)).thenReturn(1L);

        Map<Chain, List<TrendingToken>> result = engine().detectByChain();

        assertThat(result).containsOnlyKeys(Chain.EVM);
        assertThat(result.get(Chain.EVM)).extracting(TrendingToken::getContract).containsExactly(evm);
    }

    @Test
    @DisplayName("invalid configuration fails at construction")
    void constructor_validatesConfiguration() {
        trendingProperties.setWindowMinutes(0);
        assertThatThrownBy(this::engine).isInstanceOf(IllegalArgumentException.class);

        trendingProperties.setWindowMinutes(5);
        trendingProperties.setMinMentions(0);
        assertThatThrownBy(this::engine).isInstanceOf(IllegalArgumentException.class);

        trendingProperties.setMinMentions(3);
        trendingProperties.setMinUniqueSources(0);
        assertThatThrownBy(this::engine).isInstanceOf(IllegalArgumentException.class);

        trendingProperties.setMinUniqueSources(2);
        liquidityProperties.setMinLiquidityUsd(-1);
        assertThatThrownBy(this::engine).isInstanceOf(IllegalArgumentException.class);
    }
}

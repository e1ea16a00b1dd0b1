package com.alpharadar.metrics;

import com.alpharadar.domain.Chain;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer meters for ingestion, detection cycles and alerting. Counters are registered eagerly per chain
 * so they show up as zero before the first event.
 */
@Slf4j
@Component
public class RadarMetrics {

    public static final String MENTIONS_PROCESSED = "radar.mentions.processed";
    public static final String MENTIONS_RECORDED = "radar.mentions.recorded";
    public static final String MENTIONS_DUPLICATES = "radar.mentions.duplicates";
    public static final String ALERTS_SENT = "radar.alerts.sent";
    public static final String ALERTS_SUPPRESSED = "radar.alerts.suppressed";
    public static final String ALERTS_FAILED = "radar.alerts.failed";
    public static final String CYCLES = "radar.cycles";
    public static final String TRENDING_TOKENS = "radar.trending.tokens";

    public static final String OUTCOME_COMPLETED = "completed";
    public static final String OUTCOME_FAILED = "failed";
    public static final String OUTCOME_SKIPPED = "skipped";

    private final Map<Chain, Counter> processed = new EnumMap<>(Chain.class);
    private final Map<Chain, Counter> recorded = new EnumMap<>(Chain.class);
    private final Map<Chain, Counter> duplicates = new EnumMap<>(Chain.class);
    private final Map<Chain, Counter> sent = new EnumMap<>(Chain.class);
    private final Map<Chain, AtomicInteger> trending = new EnumMap<>(Chain.class);
    private final Counter suppressed;
    private final Counter failed;
    private final Counter cyclesCompleted;
    private final Counter cyclesFailed;
    private final Counter cyclesSkipped;

    public RadarMetrics(MeterRegistry meterRegistry) {
        for (Chain chain : Chain.values()) {
            processed.put(chain, Counter.builder(MENTIONS_PROCESSED)
                    .tag("chain", chain.key())
                    .description("Mentions handed to ingestion, new or duplicate")
                    .register(meterRegistry));
            recorded.put(chain, Counter.builder(MENTIONS_RECORDED)
                    .tag("chain", chain.key())
                    .description("New contract mentions written to the store")
                    .register(meterRegistry));
            duplicates.put(chain, Counter.builder(MENTIONS_DUPLICATES)
                    .tag("chain", chain.key())
                    .description("Mentions ignored because the same message was already recorded")
                    .register(meterRegistry));
            sent.put(chain, Counter.builder(ALERTS_SENT)
                    .tag("chain", chain.key())
                    .description("Trending alerts dispatched")
                    .register(meterRegistry));
            AtomicInteger size = new AtomicInteger();
            trending.put(chain, size);
            Gauge.builder(TRENDING_TOKENS, size, AtomicInteger::get)
                    .tag("chain", chain.key())
                    .description("Tokens trending in the last detection cycle")
                    .register(meterRegistry);
        }
        suppressed = Counter.builder(ALERTS_SUPPRESSED)
                .description("Trending tokens skipped because of an active cooldown")
                .register(meterRegistry);
        failed = Counter.builder(ALERTS_FAILED)
                .description("Alert deliveries that raised an error")
                .register(meterRegistry);
        cyclesCompleted = cycleCounter(meterRegistry, OUTCOME_COMPLETED);
        cyclesFailed = cycleCounter(meterRegistry, OUTCOME_FAILED);
        cyclesSkipped = cycleCounter(meterRegistry, OUTCOME_SKIPPED);
        log.debug("Radar metrics registered for chains {}", recorded.keySet());
    }

    private static Counter cycleCounter(MeterRegistry registry, String outcome) {
        return Counter.builder(CYCLES)
                .tag("outcome", outcome)
                .description("Detection cycles by outcome")
                .register(registry);
    }

    public void mentionProcessed(Chain chain) {
        processed.get(chain).increment();
    }

    public void mentionRecorded(Chain chain) {
        recorded.get(chain).increment();
    }

    public void mentionDuplicate(Chain chain) {
        duplicates.get(chain).increment();
    }

    public void alertSent(Chain chain) {
        sent.get(chain).increment();
    }

    public void alertSuppressed() {
        suppressed.increment();
    }

    public void alertFailed() {
        failed.increment();
    }

    public void cycleCompleted() {
        cyclesCompleted.increment();
    }

    public void cycleFailed() {
        cyclesFailed.increment();
    }

    public void cycleSkipped() {
        cyclesSkipped.increment();
    }

    /** Sets the trending gauge for every chain; chains absent from the map drop to zero. */
    public void trendingSizes(Map<Chain, Integer> sizes) {
        for (Chain chain : Chain.values()) {
            trending.get(chain).set(sizes.getOrDefault(chain, 0));
        }
    }

    public long mentionsProcessedTotal() {
        return (long) processed.values().stream().mapToDouble(Counter::count).sum();
    }

    public long mentionsRecordedTotal() {
        return (long) recorded.values().stream().mapToDouble(Counter::count).sum();
    }

    public long alertsSentTotal() {
        return (long) sent.values().stream().mapToDouble(Counter::count).sum();
    }

    public long cyclesCompletedTotal() {
        return (long) cyclesCompleted.count();
    }

    public long cyclesFailedTotal() {
        return (long) cyclesFailed.count();
    }

    public int trendingSize(Chain chain) {
        return trending.get(chain).get();
    }
}

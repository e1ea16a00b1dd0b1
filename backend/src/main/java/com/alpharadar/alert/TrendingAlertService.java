package com.alpharadar.alert;

import com.alpharadar.alert.config.AlertProperties;
import com.alpharadar.domain.AlertRecord;
import com.alpharadar.domain.AlertRecordRepository;
import com.alpharadar.domain.Chain;
import com.alpharadar.metrics.RadarMetrics;
import com.alpharadar.trending.TrendingEngine;
import com.alpharadar.trending.TrendingToken;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One detection cycle: per-chain detection, cooldown filter, dispatch, cooldown bookkeeping, alert history.
 * Cycles never overlap; a trigger arriving while one runs is skipped. A token gets a cooldown entry only after
 * its dispatch returned normally.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TrendingAlertService {

    private final TrendingEngine trendingEngine;
    private final CooldownGate cooldownGate;
    private final AlertDispatcher alertDispatcher;
    private final AlertRecordRepository alertRecordRepository;
    private final AlertProperties alertProperties;
    private final RadarMetrics metrics;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean stopping;

    /**
     * Store failures from detection propagate; nothing is dispatched in that case.
     */
    public CycleReport runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Previous detection cycle still running, skipping this tick");
            metrics.cycleSkipped();
            return CycleReport.skippedCycle();
        }
        try {
            return doRunCycle();
        } finally {
            running.set(false);
        }
    }

    private CycleReport doRunCycle() {
        Map<Chain, List<TrendingToken>> byChain = trendingEngine.detectByChain();
        int trending = 0;
        int sent = 0;
        int suppressed = 0;
        int failed = 0;
        int abandoned = 0;
        Map<Chain, Integer> sizes = new EnumMap<>(Chain.class);

        for (Map.Entry<Chain, List<TrendingToken>> entry : byChain.entrySet()) {
            sizes.put(entry.getKey(), entry.getValue().size());
            for (TrendingToken token : entry.getValue()) {
                trending++;
                if (stopping) {
                    abandoned++;
                    continue;
                }
                if (cooldownGate.isOnCooldown(token.getContract())) {
                    suppressed++;
                    metrics.alertSuppressed();
                    log.debug("Cooldown active for {}", token.getContract());
                    continue;
                }
                try {
                    alertDispatcher.dispatch(token);
                } catch (RuntimeException e) {
                    failed++;
                    metrics.alertFailed();
                    log.error("Alert delivery failed for {} ({})", token.getContract(), token.getChain(), e);
                    continue;
                }
                cooldownGate.recordAlert(token.getContract());
                sent++;
                metrics.alertSent(token.getChain());
                saveHistory(token);
            }
        }

        int swept = alertProperties.isSweepEachCycle() ? cooldownGate.sweepExpired() : 0;
        metrics.trendingSizes(sizes);
        metrics.cycleCompleted();
        if (abandoned > 0) {
            log.warn("Shutdown in progress, {} trending tokens left undispatched", abandoned);
        }
        CycleReport report = new CycleReport(false, trending, sent, suppressed, failed, swept, abandoned);
        if (trending > 0) {
            log.info("Cycle done: trending={} sent={} suppressed={} failed={} swept={}",
                    trending, sent, suppressed, failed, swept);
        } else {
            log.debug("Cycle done: nothing trending, swept={}", swept);
        }
        return report;
    }

    private void saveHistory(TrendingToken token) {
        AlertRecord record = new AlertRecord();
        record.setContract(token.getContract());
        record.setChain(token.getChain());
        record.setScore(token.getScore());
        record.setMentionCount(token.getMentionCount());
        record.setUniqueSources(token.getUniqueSources());
        record.setVelocity(token.getVelocity());
        record.setAlertedAt(clock.instant());
        try {
            alertRecordRepository.save(record);
        } catch (DataAccessException e) {
            log.warn("Alert history write failed for {}: {}", token.getContract(), e.getMessage());
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    void stop() {
        stopping = true;
    }
}

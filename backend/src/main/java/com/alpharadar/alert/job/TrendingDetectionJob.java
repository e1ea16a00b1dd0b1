package com.alpharadar.alert.job;

import com.alpharadar.alert.TrendingAlertService;
import com.alpharadar.ingestion.store.MentionStoreException;
import com.alpharadar.metrics.RadarMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-delay trigger for trending detection. A failed cycle is logged and retried on the next tick.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TrendingDetectionJob {

    private final TrendingAlertService trendingAlertService;
    private final RadarMetrics metrics;

    @Scheduled(
            fixedDelayString = "${alpharadar.trending.check-interval-ms:30000}",
            initialDelayString = "${alpharadar.trending.check-interval-ms:30000}")
    public void runScheduled() {
        try {
            trendingAlertService.runCycle();
        } catch (MentionStoreException e) {
            metrics.cycleFailed();
            log.error("Detection cycle aborted, mention store unavailable: {}", e.getMessage(), e);
        } catch (RuntimeException e) {
            metrics.cycleFailed();
            log.error("Detection cycle failed", e);
        }
    }
}

package com.alpharadar.api.controller;

import com.alpharadar.alert.CooldownGate;
import com.alpharadar.alert.TrendingAlertService;
import com.alpharadar.api.dto.StatusResponse;
import com.alpharadar.ingestion.store.MentionStore;
import com.alpharadar.metrics.RadarMetrics;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * GET /api/v1/status: liveness plus running counters. Answers 503 while the mention store is unreachable so
 * health checks can act on it; the body is the same either way.
 */
@RestController
@RequestMapping("/api/v1/status")
public class StatusController {

    private final MentionStore mentionStore;
    private final RadarMetrics metrics;
    private final CooldownGate cooldownGate;
    private final TrendingAlertService trendingAlertService;
    private final Clock clock;
    private final Instant startedAt;

    public StatusController(MentionStore mentionStore, RadarMetrics metrics, CooldownGate cooldownGate,
                            TrendingAlertService trendingAlertService, Clock clock) {
        this.mentionStore = mentionStore;
        this.metrics = metrics;
        this.cooldownGate = cooldownGate;
        this.trendingAlertService = trendingAlertService;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    @GetMapping
    public ResponseEntity<StatusResponse> status() {
        boolean storeAvailable = mentionStore.isAvailable();
        StatusResponse body = new StatusResponse(
                storeAvailable ? "ok" : "degraded",
                Duration.between(startedAt, clock.instant()).getSeconds(),
                storeAvailable,
                metrics.mentionsProcessedTotal(),
                metrics.mentionsRecordedTotal(),
                metrics.alertsSentTotal(),
                metrics.cyclesCompletedTotal(),
                metrics.cyclesFailedTotal(),
                cooldownGate.activeCount(),
                trendingAlertService.isRunning());
        return ResponseEntity.status(storeAvailable ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}

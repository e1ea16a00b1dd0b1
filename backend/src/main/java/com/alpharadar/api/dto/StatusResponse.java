package com.alpharadar.api.dto;

/**
 * GET /api/v1/status body. Counters are process-local and reset on restart.
 */
public record StatusResponse(
        String status,
        long uptimeSeconds,
        boolean storeAvailable,
        long mentionsProcessed,
        long mentionsRecorded,
        long alertsSent,
        long cyclesCompleted,
        long cyclesFailed,
        int activeCooldowns,
        boolean cycleRunning
) {
}

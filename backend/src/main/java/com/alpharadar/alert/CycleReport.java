package com.alpharadar.alert;

/**
 * Counts for one detection-and-alert cycle. {@code abandoned} are tokens left undispatched because the
 * service was shutting down.
 */
public record CycleReport(boolean skipped, int trending, int sent, int suppressed, int failed, int swept, int abandoned) {

    static CycleReport skippedCycle() {
        return new CycleReport(true, 0, 0, 0, 0, 0, 0);
    }
}

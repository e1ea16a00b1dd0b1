package com.alpharadar.ingestion;

import com.alpharadar.domain.Chain;
import com.alpharadar.ingestion.store.MentionStore;
import com.alpharadar.metrics.RadarMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

/**
 * Entry point for mentions extracted upstream. Canonicalizes the address for its chain and writes it
 * through the mention store; re-delivery of the same message is a no-op.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MentionIngestionService {

    private final MentionStore mentionStore;
    private final RadarMetrics metrics;
    private final Clock clock;

    /**
     * @param observedAt message timestamp; null means now
     * @return true if this is a new mention, false for a duplicate
     */
    public boolean record(String contract, Chain chain, long sourceId, long occurrenceId, Instant observedAt) {
        if (chain == null) {
            throw new IllegalArgumentException("chain is required");
        }
        String canonical = chain.normalize(contract);
        if (canonical == null || canonical.isEmpty()) {
            throw new IllegalArgumentException("contract is required");
        }
        Instant at = observedAt != null ? observedAt : clock.instant();
        metrics.mentionProcessed(chain);
        boolean inserted = mentionStore.recordMention(canonical, chain, sourceId, occurrenceId, at);
        if (inserted) {
            metrics.mentionRecorded(chain);
            log.info("New mention: {} ({}) source={} occurrence={}", canonical, chain, sourceId, occurrenceId);
        } else {
            metrics.mentionDuplicate(chain);
            log.debug("Duplicate mention ignored: {} source={} occurrence={}", canonical, sourceId, occurrenceId);
        }
        return inserted;
    }
}

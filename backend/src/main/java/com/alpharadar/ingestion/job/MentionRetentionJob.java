package com.alpharadar.ingestion.job;

import com.alpharadar.ingestion.config.MentionStoreProperties;
import com.alpharadar.ingestion.store.MentionStore;
import com.alpharadar.ingestion.store.MentionStoreException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Periodic purge of mentions older than alpharadar.mentions.retention-hours.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MentionRetentionJob {

    private final MentionStore mentionStore;
    private final MentionStoreProperties properties;
    private final Clock clock;

    @Scheduled(
            fixedDelayString = "${alpharadar.mentions.purge-interval-ms:3600000}",
            initialDelayString = "${alpharadar.mentions.purge-interval-ms:3600000}")
    public void runScheduled() {
        purgeExpired();
    }

    /** @return mentions removed, or -1 when the store was unavailable */
    public long purgeExpired() {
        Instant cutoff = clock.instant().minus(Duration.ofHours(properties.getRetentionHours()));
        try {
            long removed = mentionStore.purgeBefore(cutoff);
            if (removed > 0) {
                log.info("Purged {} mentions observed before {}", removed, cutoff);
            }
            return removed;
        } catch (MentionStoreException e) {
            log.error("Mention purge failed, retrying next period", e);
            return -1;
        }
    }
}

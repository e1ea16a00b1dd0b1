package com.alpharadar.ingestion.store;

import com.alpharadar.domain.Chain;
import com.alpharadar.domain.ContractMention;
import com.alpharadar.domain.ContractMentionRepository;
import com.alpharadar.domain.MentionAggregate;
import com.alpharadar.ingestion.config.MentionStoreProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * MongoDB-backed mention log. Read queries carry a server-side max time from alpharadar.mentions.query-timeout.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MongoMentionStore implements MentionStore {

    private final ContractMentionRepository repository;
    private final MentionStoreProperties properties;

    @Override
    public List<MentionAggregate> aggregateWindow(Instant since, Chain chain, int minMentions, int minUniqueSources) {
        try {
            return repository.aggregateSince(since, chain, minMentions, minUniqueSources, properties.getQueryTimeout());
        } catch (DataAccessException e) {
            throw new MentionStoreException("Window aggregation failed since " + since + " chain " + chain, e);
        }
    }

    @Override
    public long countInRange(String contract, Instant since, Instant until) {
        if (!since.isBefore(until)) {
            return 0L;
        }
        try {
            return repository.countObservedBetween(contract, since, until, properties.getQueryTimeout());
        } catch (DataAccessException e) {
            throw new MentionStoreException("Range count failed for " + contract, e);
        }
    }

    @Override
    public boolean recordMention(String contract, Chain chain, long sourceId, long occurrenceId, Instant observedAt) {
        try {
            return repository.insertIfAbsent(new ContractMention(contract, chain, sourceId, occurrenceId, observedAt));
        } catch (DataAccessException e) {
            throw new MentionStoreException("Recording mention failed for " + contract, e);
        }
    }

    @Override
    public long purgeBefore(Instant cutoff) {
        try {
            return repository.deleteObservedBefore(cutoff);
        } catch (DataAccessException e) {
            throw new MentionStoreException("Purge failed before " + cutoff, e);
        }
    }

    @Override
    public boolean isAvailable() {
        try {
            repository.ping();
            return true;
        } catch (DataAccessException e) {
            log.warn("Mention store ping failed: {}", e.getMessage());
            return false;
        }
    }
}

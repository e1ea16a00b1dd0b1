package com.alpharadar.ingestion.store;

import com.alpharadar.domain.Chain;
import com.alpharadar.domain.MentionAggregate;

import java.time.Instant;
import java.util.List;

/**
 * Append-only log of contract mentions. Reads used by trending detection, write used by ingestion,
 * purge used by the retention job. Implementations throw {@link MentionStoreException} on backend failure;
 * callers never receive a partial result.
 */
public interface MentionStore {

    /**
     * Per (contract, chain) totals for mentions with observedAt >= since, restricted to groups with
     * mentionCount >= minMentions and uniqueSources >= minUniqueSources.
     *
     * @param chain null to aggregate across all chains
     */
    List<MentionAggregate> aggregateWindow(Instant since, Chain chain, int minMentions, int minUniqueSources);

    /** Mentions of the contract with since <= observedAt < until, any chain, any source. */
    long countInRange(String contract, Instant since, Instant until);

    /** Idempotent on (contract, sourceId, occurrenceId): returns false when the mention already exists. */
    boolean recordMention(String contract, Chain chain, long sourceId, long occurrenceId, Instant observedAt);

    /** Removes mentions observed strictly before the cutoff. */
    long purgeBefore(Instant cutoff);

    /** True when the backing store answers a ping. */
    boolean isAvailable();
}

package com.alpharadar.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Custom repository methods using MongoTemplate (upsert, aggregation pipeline, range count).
 */
public interface ContractMentionRepositoryCustom {

    /**
     * Inserts the mention unless (contract, sourceId, occurrenceId) already exists.
     * Returns true only when a new document was written.
     */
    boolean insertIfAbsent(ContractMention mention);

    /**
     * Groups mentions with observedAt >= since by (contract, chain), counting mentions and distinct sources.
     * Only groups meeting both minimums are returned. Null chain means all chains.
     */
    List<MentionAggregate> aggregateSince(Instant since, Chain chain, int minMentions, int minUniqueSources, Duration maxTime);

    /** Mentions of the contract with since <= observedAt < until, across all chains and sources. */
    long countObservedBetween(String contract, Instant since, Instant until, Duration maxTime);

    /** Deletes mentions with observedAt < before; returns the number removed. */
    long deleteObservedBefore(Instant before);

    /** Round-trips a ping command to the server. */
    void ping();
}

package com.alpharadar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One observed occurrence of a contract address in one message. Never mutated after insert;
 * removed only by the retention sweep.
 * (contract, sourceId, occurrenceId) is unique: re-detecting the same address in the same message is not a new fact.
 */
@Document(collection = "contract_mentions")
@CompoundIndex(name = "contract_source_occurrence", def = "{'contract': 1, 'sourceId': 1, 'occurrenceId': 1}", unique = true)
@CompoundIndex(name = "contract_observed", def = "{'contract': 1, 'observedAt': 1}")
@CompoundIndex(name = "chain_observed", def = "{'chain': 1, 'observedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ContractMention {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String contract;
    private Chain chain;
    /** Chat, group or channel the message came from. */
    private long sourceId;
    /** Message id within the source. */
    private long occurrenceId;
    private Instant observedAt;

    public ContractMention(String contract, Chain chain, long sourceId, long occurrenceId, Instant observedAt) {
        this.contract = contract;
        this.chain = chain;
        this.sourceId = sourceId;
        this.occurrenceId = occurrenceId;
        this.observedAt = observedAt;
    }
}

package com.alpharadar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

/**
 * Persistence for contract_mentions. Window aggregation and idempotent insert live in
 * {@link ContractMentionRepositoryCustom}.
 */
public interface ContractMentionRepository extends MongoRepository<ContractMention, String>, ContractMentionRepositoryCustom {

    Optional<ContractMention> findByContractAndSourceIdAndOccurrenceId(String contract, long sourceId, long occurrenceId);

    long countByContract(String contract);
}

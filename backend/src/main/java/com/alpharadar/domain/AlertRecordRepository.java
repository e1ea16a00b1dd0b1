package com.alpharadar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for alert_history.
 */
public interface AlertRecordRepository extends MongoRepository<AlertRecord, String> {

    List<AlertRecord> findByContractOrderByAlertedAtDesc(String contract);
}

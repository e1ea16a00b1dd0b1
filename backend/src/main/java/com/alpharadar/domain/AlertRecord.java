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
 * Audit row for a dispatched trending alert. Write-only from the alert cycle; not read back by detection.
 */
@Document(collection = "alert_history")
@CompoundIndex(name = "contract_alerted", def = "{'contract': 1, 'alertedAt': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class AlertRecord {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String contract;
    private Chain chain;
    private double score;
    private int mentionCount;
    private int uniqueSources;
    private double velocity;
    private Instant alertedAt;
}

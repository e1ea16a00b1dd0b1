package com.alpharadar.domain;

import com.mongodb.client.result.UpdateResult;
import lombok.RequiredArgsConstructor;
import org.bson.Document;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.AggregationOptions;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * MongoTemplate-backed custom queries for contract_mentions.
 */
@Repository
@RequiredArgsConstructor
public class ContractMentionRepositoryImpl implements ContractMentionRepositoryCustom {

    static final String COLLECTION = "contract_mentions";

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean insertIfAbsent(ContractMention mention) {
        Query key = new Query(where("contract").is(mention.getContract())
                .and("sourceId").is(mention.getSourceId())
                .and("occurrenceId").is(mention.getOccurrenceId()));
        Update onInsert = new Update()
                .setOnInsert("chain", mention.getChain())
                .setOnInsert("observedAt", mention.getObservedAt());
        try {
            UpdateResult result = mongoTemplate.upsert(key, onInsert, ContractMention.class);
            return result.getUpsertedId() != null;
        } catch (DuplicateKeyException e) {
            // concurrent upsert of the same key lost the race on the unique index
            return false;
        }
    }

    @Override
    public List<MentionAggregate> aggregateSince(Instant since, Chain chain, int minMentions, int minUniqueSources,
                                                 Duration maxTime) {
        Document window = new Document("observedAt", new Document("$gte", Date.from(since)));
        if (chain != null) {
            window.append("chain", chain.name());
        }
        // stage 1 collapses to one row per source so stage 2 can count distinct sources with $sum: 1
        AggregationOperation matchWindow = context -> new Document("$match", window);
        AggregationOperation perSource = context -> new Document("$group", new Document()
                .append("_id", new Document("contract", "$contract").append("chain", "$chain").append("sourceId", "$sourceId"))
                .append("mentions", new Document("$sum", 1)));
        AggregationOperation perContract = context -> new Document("$group", new Document()
                .append("_id", new Document("contract", "$_id.contract").append("chain", "$_id.chain"))
                .append("mentionCount", new Document("$sum", "$mentions"))
                .append("uniqueSources", new Document("$sum", 1)));
        AggregationOperation thresholds = context -> new Document("$match", new Document()
                .append("mentionCount", new Document("$gte", minMentions))
                .append("uniqueSources", new Document("$gte", minUniqueSources)));

        Aggregation aggregation = Aggregation.newAggregation(matchWindow, perSource, perContract, thresholds)
                .withOptions(AggregationOptions.builder().maxTime(maxTime).build());

        List<Document> rows = mongoTemplate.aggregate(aggregation, COLLECTION, Document.class).getMappedResults();
        List<MentionAggregate> out = new ArrayList<>(rows.size());
        for (Document row : rows) {
            Document id = row.get("_id", Document.class);
            out.add(new MentionAggregate(
                    id.getString("contract"),
                    Chain.valueOf(id.getString("chain")),
                    ((Number) row.get("mentionCount")).intValue(),
                    ((Number) row.get("uniqueSources")).intValue()));
        }
        return out;
    }

    @Override
    public long countObservedBetween(String contract, Instant since, Instant until, Duration maxTime) {
        Query query = new Query(where("contract").is(contract).and("observedAt").gte(since).lt(until))
                .maxTime(maxTime);
        return mongoTemplate.count(query, ContractMention.class);
    }

    @Override
    public long deleteObservedBefore(Instant before) {
        Query query = new Query(where("observedAt").lt(before));
        return mongoTemplate.remove(query, ContractMention.class).getDeletedCount();
    }

    @Override
    public void ping() {
        mongoTemplate.executeCommand(new Document("ping", 1));
    }
}

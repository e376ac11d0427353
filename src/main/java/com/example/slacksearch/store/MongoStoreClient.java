package com.example.slacksearch.store;

import java.util.*;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.stereotype.Component;

@Component
public class MongoStoreClient implements StoreClient {

    private static final Logger logger = LoggerFactory.getLogger(MongoStoreClient.class);

    // stages that write; the index is populated offline and never modified from here
    private static final Set<String> WRITE_STAGES = Set.of("$out", "$merge");

    private final MongoTemplate mongo;

    @Autowired
    public MongoStoreClient(MongoTemplate mongo) {
        this.mongo = mongo;
    }

    @Override
    public List<Map<String, Object>> aggregate(String collection, List<Map<String, Object>> pipeline) {
        List<AggregationOperation> ops = new ArrayList<>();
        for (Map<String, Object> stage : pipeline) {
            if (stage.size() != 1) {
                throw new IllegalArgumentException("Aggregation stage must have exactly one operator: " + stage.keySet());
            }
            String operator = stage.keySet().iterator().next();
            if (WRITE_STAGES.contains(operator)) {
                throw new IllegalArgumentException("Write stage " + operator + " not allowed against " + collection);
            }
            Document doc = new Document(stage);
            ops.add(context -> doc);
        }
        Aggregation agg = Aggregation.newAggregation(ops);
        long started = System.nanoTime();
        List<Map<String, Object>> out = new ArrayList<>();
        mongo.aggregate(agg, collection, Document.class).forEach(out::add);
        logger.debug("Aggregation on {} returned {} rows in {}ms", collection, out.size(), (System.nanoTime() - started) / 1_000_000);
        return out;
    }

    @Override
    public void ping() {
        mongo.executeCommand(new Document("ping", 1));
    }
}

package com.example.slacksearch.search;

import com.example.slacksearch.store.StoreClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Nearest-neighbour search over the message index using a {@code $vectorSearch} stage.
 */
@Component
public class MongoVectorIndex implements VectorIndex {

    private static final int CANDIDATE_FACTOR = 10;

    private final StoreClient store;
    private final String collection;
    private final String indexName;
    private final String embeddingPath;

    public MongoVectorIndex(StoreClient store,
                            @Value("${app.search.index.collection:slack_content}") String collection,
                            @Value("${app.search.index.name:embeddings_index}") String indexName,
                            @Value("${app.search.index.path:embeddings}") String embeddingPath) {
        this.store = store;
        this.collection = collection;
        this.indexName = indexName;
        this.embeddingPath = embeddingPath;
    }

    @Override
    public List<SearchHit> nearest(float[] embedding, int topK) {
        List<Double> vector = new ArrayList<>(embedding.length);
        for (float v : embedding) {
            vector.add((double) v);
        }
        List<Map<String, Object>> pipeline = List.of(
                Map.of("$vectorSearch", Map.of(
                        "index", indexName,
                        "path", embeddingPath,
                        "queryVector", vector,
                        "numCandidates", topK * CANDIDATE_FACTOR,
                        "limit", topK)),
                Map.of("$project", Map.of(
                        "_id", 0,
                        "channel", 1,
                        "ts", 1,
                        "score", Map.of("$meta", "vectorSearchScore"))));

        List<SearchHit> hits = new ArrayList<>();
        for (Map<String, Object> row : store.aggregate(collection, pipeline)) {
            Object score = row.get("score");
            hits.add(SearchHit.builder()
                    .channelId(String.valueOf(row.get("channel")))
                    .ts(formatTs(row.get("ts")))
                    .distance(score instanceof Number ? 1.0 - ((Number) score).doubleValue() : 1.0)
                    .build());
        }
        return hits;
    }

    /**
     * Slack timestamps are strings with six fractional digits; the index may hold them as numbers.
     */
    static String formatTs(Object ts) {
        if (ts instanceof Number) {
            return new BigDecimal(ts.toString()).setScale(6, RoundingMode.HALF_UP).toPlainString();
        }
        return String.valueOf(ts);
    }
}

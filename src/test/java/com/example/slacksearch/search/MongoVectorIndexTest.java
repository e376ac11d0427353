package com.example.slacksearch.search;

import com.example.slacksearch.store.StoreClient;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoVectorIndexTest {

    @Mock
    private StoreClient store;

    @Test
    @SuppressWarnings("unchecked")
    void testNearest_RunsVectorSearchAndMapsRows() {
        // Given
        MongoVectorIndex index = new MongoVectorIndex(store, "slack_content", "embeddings_index", "embeddings");
        when(store.aggregate(eq("slack_content"), anyList())).thenReturn(List.of(
                Map.of("channel", "C1", "ts", 1700000000.0001, "score", 0.9),
                Map.of("channel", "C2", "ts", "1700000100.000100", "score", 0.75)));

        // When
        List<SearchHit> hits = index.nearest(new float[]{0.5f, 0.25f}, 15);

        // Then
        assertEquals(2, hits.size());
        assertEquals("C1", hits.get(0).getChannelId());
        assertEquals("1700000000.000100", hits.get(0).getTs());
        assertEquals(0.1, hits.get(0).getDistance(), 1e-9);
        assertEquals("1700000100.000100", hits.get(1).getTs());

        ArgumentCaptor<List<Map<String, Object>>> pipeline = ArgumentCaptor.forClass(List.class);
        verify(store).aggregate(eq("slack_content"), pipeline.capture());
        Map<String, Object> stage = (Map<String, Object>) pipeline.getValue().get(0).get("$vectorSearch");
        assertEquals("embeddings_index", stage.get("index"));
        assertEquals(150, stage.get("numCandidates"));
        assertEquals(15, stage.get("limit"));
        assertEquals(List.of(0.5, 0.25), stage.get("queryVector"));
    }

    @Test
    void testFormatTs() {
        assertEquals("1700000000.123456", MongoVectorIndex.formatTs(1700000000.123456));
        assertEquals("1700000000.000000", MongoVectorIndex.formatTs(1700000000L));
        assertEquals("1700000000.000100", MongoVectorIndex.formatTs("1700000000.000100"));
    }
}

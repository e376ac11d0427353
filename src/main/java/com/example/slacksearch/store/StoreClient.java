package com.example.slacksearch.store;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the document store that holds the message index.
 */
public interface StoreClient {
    List<Map<String,Object>> aggregate(String collection, List<Map<String,Object>> pipeline);

    /** Round-trips a no-op command; throws if the store is unreachable. */
    void ping();
}

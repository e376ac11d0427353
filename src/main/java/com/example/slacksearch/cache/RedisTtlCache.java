package com.example.slacksearch.cache;

import com.example.slacksearch.kv.KvClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * {@link TtlCache} shared between instances through the KV store. Values are stored as JSON
 * under {@code <namespace>:<key>} with the store's native expiry. A store or decoding failure
 * reads as a miss, since the cache is never the source of truth.
 */
public class RedisTtlCache<V> implements TtlCache<String, V> {

    private static final Logger logger = LoggerFactory.getLogger(RedisTtlCache.class);

    private final String namespace;
    private final Duration ttl;
    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final Class<V> type;

    public RedisTtlCache(String namespace, Duration ttl, KvClient kvClient, ObjectMapper objectMapper, Class<V> type) {
        this.namespace = namespace;
        this.ttl = ttl;
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.type = type;
    }

    @Override
    public Optional<V> get(String key) {
        try {
            Optional<String> raw = kvClient.get(cacheKey(key));
            if (raw.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(raw.get(), type));
        } catch (JsonProcessingException e) {
            logger.warn("Discarding undecodable {} entry for key {}", namespace, key);
            invalidate(key);
            return Optional.empty();
        } catch (RuntimeException e) {
            logger.warn("KV read failed for {} key {}, treating as miss: {}", namespace, key, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void put(String key, V value) {
        try {
            kvClient.set(cacheKey(key), objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            logger.warn("Could not encode {} entry for key {}", namespace, key, e);
        } catch (RuntimeException e) {
            logger.warn("KV write failed for {} key {}: {}", namespace, key, e.getMessage());
        }
    }

    @Override
    public void invalidate(String key) {
        try {
            kvClient.del(cacheKey(key));
        } catch (RuntimeException e) {
            logger.warn("KV delete failed for {} key {}: {}", namespace, key, e.getMessage());
        }
    }

    String cacheKey(String key) {
        return namespace + ":" + key;
    }
}

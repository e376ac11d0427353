package com.example.slacksearch.controller;

import com.example.slacksearch.kv.KvClient;
import com.example.slacksearch.store.StoreClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness and dependency reachability. These paths bypass the access gateway.
 */
@RestController
public class HealthController {

    private final KvClient kvClient;
    private final StoreClient storeClient;
    private final boolean redisCache;

    public HealthController(KvClient kvClient, StoreClient storeClient,
                            @Value("${app.cache.backend:memory}") String cacheBackend) {
        this.kvClient = kvClient;
        this.storeClient = storeClient;
        this.redisCache = "redis".equalsIgnoreCase(cacheBackend);
    }

    @GetMapping({"/health", "/healthz"})
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("service", "slack-search-mcp");
        health.put("version", McpServerController.SERVER_VERSION);

        // Test MongoDB connection
        try {
            storeClient.ping();
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
        }

        // Redis only matters when it backs the shared cache
        if (redisCache) {
            try {
                kvClient.get("health-check");
                health.put("redis", "UP");
            } catch (Exception e) {
                health.put("redis", "DOWN");
                health.put("redisError", e.getMessage());
            }
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}

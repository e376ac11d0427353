package com.example.slacksearch.config;

import com.example.slacksearch.cache.IdentityCache;
import com.example.slacksearch.cache.InMemoryTtlCache;
import com.example.slacksearch.cache.RedisTtlCache;
import com.example.slacksearch.directory.DirectoryUser;
import com.example.slacksearch.directory.WorkspaceInfo;
import com.example.slacksearch.kv.KvClient;
import com.example.slacksearch.model.AccessDecision;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Builds the identity caches on the configured backend: {@code memory} (per instance, the
 * default) or {@code redis} (shared through the KV store).
 */
@Configuration
public class CacheConfig {

    private static final Logger logger = LoggerFactory.getLogger(CacheConfig.class);

    @Bean
    public IdentityCache identityCache(@Value("${app.cache.backend:memory}") String backend,
                                       @Value("${app.cache.users-ttl-seconds:3600}") long usersTtl,
                                       @Value("${app.cache.channels-ttl-seconds:600}") long channelsTtl,
                                       @Value("${app.cache.user-names-ttl-seconds:3600}") long userNamesTtl,
                                       @Value("${app.cache.workspace-ttl-seconds:3600}") long workspaceTtl,
                                       KvClient kvClient,
                                       ObjectMapper objectMapper,
                                       Clock clock) {
        logger.info("Identity caches on {} backend (users {}s, channels {}s, names {}s, workspace {}s)",
                backend, usersTtl, channelsTtl, userNamesTtl, workspaceTtl);
        switch (backend.toLowerCase()) {
            case "memory":
                return new IdentityCache(
                        new InMemoryTtlCache<>("users-by-email", Duration.ofSeconds(usersTtl), clock),
                        new InMemoryTtlCache<>("channel-access", Duration.ofSeconds(channelsTtl), clock),
                        new InMemoryTtlCache<>("user-names", Duration.ofSeconds(userNamesTtl), clock),
                        new InMemoryTtlCache<>("workspace", Duration.ofSeconds(workspaceTtl), clock));
            case "redis":
                return new IdentityCache(
                        new RedisTtlCache<>("slacksearch:users", Duration.ofSeconds(usersTtl), kvClient, objectMapper, DirectoryUser.class),
                        new RedisTtlCache<>("slacksearch:channels", Duration.ofSeconds(channelsTtl), kvClient, objectMapper, AccessDecision.class),
                        new RedisTtlCache<>("slacksearch:names", Duration.ofSeconds(userNamesTtl), kvClient, objectMapper, String.class),
                        new RedisTtlCache<>("slacksearch:workspace", Duration.ofSeconds(workspaceTtl), kvClient, objectMapper, WorkspaceInfo.class));
            default:
                throw new IllegalStateException("Unknown app.cache.backend: " + backend);
        }
    }
}

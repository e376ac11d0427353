package com.example.slacksearch.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One "principal X acted as user Y at time T" record. Written once, never updated,
 * removed by the TTL index on {@code expiresAt}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("impersonation_log")
public class ImpersonationLogEntry {
    @Id
    private String id;
    private String actingPrincipal;
    private String targetIdentity;
    @Indexed
    private Instant timestamp;
    @Indexed(expireAfter = "0s")
    private Instant expiresAt;
}

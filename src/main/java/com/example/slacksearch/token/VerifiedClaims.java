package com.example.slacksearch.token;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class VerifiedClaims {
    String subject;
    String email;
    String issuer;
    List<String> audience;
    Instant expiresAt;
}

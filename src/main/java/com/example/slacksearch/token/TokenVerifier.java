package com.example.slacksearch.token;

import com.example.slacksearch.auth.AuthResult;

/**
 * Verifies a signed identity assertion.
 *
 * <p>Implementations are pure: no caching of outcomes, no side effects beyond fetching the
 * signing keys they need. A {@code null} expected audience skips the audience check, which only
 * the audience-free intermediary policy is allowed to ask for.
 */
public interface TokenVerifier {

    AuthResult<VerifiedClaims> verify(String assertion, String expectedAudience);
}

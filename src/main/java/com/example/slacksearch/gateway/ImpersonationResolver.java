package com.example.slacksearch.gateway;

import com.example.slacksearch.auth.AuthFailure;
import com.example.slacksearch.auth.AuthResult;
import com.example.slacksearch.ratelimit.WindowedCounter;
import com.example.slacksearch.token.TokenVerifier;
import com.example.slacksearch.token.VerifiedClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Decides whether the verified caller is acting for someone else and, if so, verifies the
 * on-behalf-of token under the caller's intermediary policy and applies the impersonation
 * rate limit.
 */
@Component
public class ImpersonationResolver {

    private static final Logger logger = LoggerFactory.getLogger(ImpersonationResolver.class);

    private final TokenVerifier userTokenVerifier;
    private final WindowedCounter windowedCounter;
    private final IntermediaryPolicyTable policyTable;
    private final Duration window;
    private final int maxUnique;

    public ImpersonationResolver(@Qualifier("userTokenVerifier") TokenVerifier userTokenVerifier,
                                 WindowedCounter windowedCounter,
                                 GatewayProperties gatewayProperties,
                                 @Value("${app.impersonation.window-seconds:60}") long windowSeconds,
                                 @Value("${app.impersonation.max-unique:20}") int maxUnique) {
        this.userTokenVerifier = userTokenVerifier;
        this.windowedCounter = windowedCounter;
        this.policyTable = IntermediaryPolicyTable.from(gatewayProperties.getIntermediaries());
        this.window = Duration.ofSeconds(windowSeconds);
        this.maxUnique = maxUnique;
        logger.info("Impersonation policy: {} (limit {} unique users / {}s)", policyTable.getRules(), maxUnique, windowSeconds);
    }

    /**
     * Resolves the acting-as identity. Does not touch the rate limiter.
     *
     * @param caller           claims of the verified perimeter assertion
     * @param onBehalfOfToken  raw on-behalf-of header value, may be {@code null}
     */
    public AuthResult<ResolvedCaller> resolve(VerifiedClaims caller, String onBehalfOfToken) {
        String principal = caller.getEmail();
        Optional<IntermediaryPolicyTable.Rule> rule = policyTable.match(principal);
        if (rule.isEmpty()) {
            return AuthResult.ok(ResolvedCaller.direct(principal));
        }

        IntermediaryPolicyTable.Rule policy = rule.get();
        if (onBehalfOfToken == null || onBehalfOfToken.isBlank()) {
            logger.warn("Intermediary {} ({}) called without an on-behalf-of token", policy.getName(), principal);
            return AuthResult.fail(AuthFailure.MISSING_IMPERSONATION_TOKEN,
                    "intermediary " + policy.getName() + " sent no on-behalf-of token");
        }

        // getAudience() is null only for AUDIENCE_FREE rules
        AuthResult<VerifiedClaims> verified = userTokenVerifier.verify(onBehalfOfToken, policy.getAudience());
        if (!verified.isOk()) {
            logger.error("On-behalf-of token from {} failed {} verification: {}", policy.getName(), policy.getMode(), verified.getDetail());
            if (verified.getFailure() == AuthFailure.MISSING_CLAIM) {
                return verified.propagate();
            }
            return AuthResult.fail(AuthFailure.INVALID_IMPERSONATION_TOKEN, verified.getDetail());
        }

        String actingAs = verified.getValue().getEmail();
        logger.info("Intermediary {} acting on behalf of {}", principal, actingAs);
        return AuthResult.ok(ResolvedCaller.onBehalfOf(principal, actingAs, policy.getName()));
    }

    /**
     * Records the impersonation and enforces the distinct-user window. Direct end users pass
     * through without touching the counter.
     */
    public AuthResult<ResolvedCaller> checkRateLimit(ResolvedCaller caller) {
        if (!caller.isImpersonated()) {
            return AuthResult.ok(caller);
        }
        boolean allowed = windowedCounter.recordAndCheck(caller.getCallerPrincipal(), caller.getActingAsEmail(), window, maxUnique);
        if (!allowed) {
            logger.warn("Rate limit exceeded: {} impersonating too many unique users ({})",
                    caller.getCallerPrincipal(), caller.getActingAsEmail());
            return AuthResult.fail(AuthFailure.RATE_LIMITED,
                    caller.getIntermediary() + " exceeded " + maxUnique + " unique users in " + window.toSeconds() + "s");
        }
        return AuthResult.ok(caller);
    }
}

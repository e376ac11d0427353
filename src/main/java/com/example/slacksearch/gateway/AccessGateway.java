package com.example.slacksearch.gateway;

import com.example.slacksearch.auth.AuthFailure;
import com.example.slacksearch.auth.AuthResult;
import com.example.slacksearch.directory.DirectoryUser;
import com.example.slacksearch.token.TokenVerifier;
import com.example.slacksearch.token.VerifiedClaims;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Set;

/**
 * Front door for every request.
 *
 * <p>Runs the verification chain strictly in order, each step returning an {@link AuthResult}:
 * <ol>
 *   <li>path allow-list (before any header is read)</li>
 *   <li>perimeter assertion</li>
 *   <li>on-behalf-of resolution for trusted intermediaries</li>
 *   <li>impersonation rate limit</li>
 *   <li>directory membership and allow-lists</li>
 * </ol>
 * On success the credential headers are stripped, the {@link ResolvedIdentity} is bound to the
 * exchange for the duration of the downstream call and removed when it completes, fails or is
 * cancelled. Any unexpected fault in the chain is rendered as a 500 without echoing details.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AccessGateway implements WebFilter {

    private static final Logger logger = LoggerFactory.getLogger(AccessGateway.class);

    private final TokenVerifier perimeterVerifier;
    private final ImpersonationResolver impersonationResolver;
    private final AuthorizationPolicy authorizationPolicy;
    private final ObjectMapper objectMapper;
    private final String assertionHeader;
    private final String userTokenHeader;
    private final String assertionAudience;
    private final Set<String> allowedPaths;
    private final Set<String> healthPaths;

    public AccessGateway(@Qualifier("perimeterTokenVerifier") TokenVerifier perimeterVerifier,
                         ImpersonationResolver impersonationResolver,
                         AuthorizationPolicy authorizationPolicy,
                         ObjectMapper objectMapper,
                         GatewayProperties properties) {
        this.perimeterVerifier = perimeterVerifier;
        this.impersonationResolver = impersonationResolver;
        this.authorizationPolicy = authorizationPolicy;
        this.objectMapper = objectMapper;
        this.assertionHeader = properties.getAssertionHeader();
        this.userTokenHeader = properties.getUserTokenHeader();
        this.assertionAudience = properties.getAssertionAudience();
        this.allowedPaths = Set.copyOf(properties.getAllowedPaths());
        this.healthPaths = Set.copyOf(properties.getHealthPaths());
        if (assertionAudience == null || assertionAudience.isBlank()) {
            throw new IllegalStateException("app.gateway.assertion-audience must be set");
        }
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();

        if (healthPaths.contains(path)) {
            return chain.filter(exchange);
        }
        if (!allowedPaths.contains(path)) {
            logger.warn("Stealth security: unauthorized access attempt to {} from {}", path, exchange.getRequest().getRemoteAddress());
            return reject(exchange, AuthFailure.FORBIDDEN_PATH);
        }

        HttpHeaders headers = exchange.getRequest().getHeaders();
        return Mono.fromCallable(() -> authenticate(headers))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(e -> {
                    logger.error("Internal security validation error on {}", path, e);
                    return Mono.just(AuthResult.<ResolvedIdentity>fail(AuthFailure.INTERNAL_ERROR, e.getClass().getSimpleName()));
                })
                .flatMap(result -> {
                    if (!result.isOk()) {
                        logger.warn("Rejected {} with {}: {}", path, result.getFailure(), result.getDetail());
                        return reject(exchange, result.getFailure());
                    }
                    return dispatch(exchange, chain, result.getValue());
                });
    }

    /**
     * Runs steps 2 to 5 of the chain. Blocking; called off the event loop.
     */
    AuthResult<ResolvedIdentity> authenticate(HttpHeaders headers) {
        GatewayState state = GatewayState.UNAUTHENTICATED;

        String assertion = headers.getFirst(assertionHeader);
        if (assertion == null || assertion.isBlank()) {
            return rejected(state, AuthResult.fail(AuthFailure.MISSING_ASSERTION, "missing " + assertionHeader));
        }
        AuthResult<VerifiedClaims> caller = perimeterVerifier.verify(assertion, assertionAudience);
        if (!caller.isOk()) {
            if (caller.getFailure() == AuthFailure.MISSING_CLAIM) {
                return rejected(state, caller.propagate());
            }
            return rejected(state, AuthResult.fail(AuthFailure.INVALID_ASSERTION, caller.getDetail()));
        }
        state = advance(state, GatewayState.ASSERTION_VERIFIED);

        AuthResult<ResolvedCaller> resolved = impersonationResolver.resolve(caller.getValue(), headers.getFirst(userTokenHeader));
        if (!resolved.isOk()) {
            return rejected(state, resolved.propagate());
        }
        state = advance(state, GatewayState.IDENTITY_RESOLVED);

        AuthResult<ResolvedCaller> rateChecked = impersonationResolver.checkRateLimit(resolved.getValue());
        if (!rateChecked.isOk()) {
            return rejected(state, rateChecked.propagate());
        }
        state = advance(state, GatewayState.RATE_CHECKED);

        ResolvedCaller resolvedCaller = rateChecked.getValue();
        AuthResult<DirectoryUser> member = authorizationPolicy.authorize(resolvedCaller.effectiveEmail());
        if (!member.isOk()) {
            return rejected(state, member.propagate());
        }
        advance(state, GatewayState.AUTHORIZED);

        DirectoryUser user = member.getValue();
        return AuthResult.ok(new ResolvedIdentity(
                resolvedCaller.getCallerPrincipal(),
                resolvedCaller.getActingAsEmail(),
                user.getId(),
                user.effectiveTeamId(),
                user.getEnterpriseId()));
    }

    private Mono<Void> dispatch(ServerWebExchange exchange, WebFilterChain chain, ResolvedIdentity identity) {
        ServerHttpRequest scrubbed = exchange.getRequest().mutate()
                .headers(h -> {
                    h.remove(userTokenHeader);
                    h.remove(assertionHeader);
                })
                .build();
        ServerWebExchange bound = exchange.mutate().request(scrubbed).build();
        bound.getAttributes().put(ResolvedIdentity.ATTRIBUTE, identity);
        logger.debug("{} -> {} for {}", GatewayState.AUTHORIZED, GatewayState.DISPATCHED, identity);

        // unbind before the terminal signal propagates
        Runnable unbind = () -> {
            if (bound.getAttributes().remove(ResolvedIdentity.ATTRIBUTE) != null) {
                logger.debug("Identity unbound for {}", identity.effectiveEmail());
            }
        };
        return chain.filter(bound)
                .doOnTerminate(unbind)
                .doOnCancel(unbind);
    }

    private Mono<Void> reject(ServerWebExchange exchange, AuthFailure failure) {
        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(failure.getStatus());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        byte[] body;
        try {
            body = objectMapper.writeValueAsBytes(Map.of("error", failure.getClientMessage()));
        } catch (JsonProcessingException e) {
            body = ("{\"error\":\"" + AuthFailure.INTERNAL_ERROR.getClientMessage() + "\"}").getBytes(StandardCharsets.UTF_8);
        }
        return response.writeWith(Mono.just(response.bufferFactory().wrap(body)));
    }

    private static GatewayState advance(GatewayState from, GatewayState to) {
        logger.debug("Gateway {} -> {}", from, to);
        return to;
    }

    private static <T> AuthResult<T> rejected(GatewayState from, AuthResult<T> failure) {
        logger.debug("Gateway {} -> {} ({})", from, GatewayState.REJECTED, failure.getFailure());
        return failure;
    }
}

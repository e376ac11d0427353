package com.example.slacksearch.gateway;

/**
 * Progress of one request through {@link AccessGateway}. {@link #REJECTED} is terminal and
 * reachable from every other state.
 */
public enum GatewayState {
    UNAUTHENTICATED,
    ASSERTION_VERIFIED,
    IDENTITY_RESOLVED,
    RATE_CHECKED,
    AUTHORIZED,
    DISPATCHED,
    REJECTED
}

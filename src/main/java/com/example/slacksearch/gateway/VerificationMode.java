package com.example.slacksearch.gateway;

/**
 * How an intermediary's on-behalf-of token is verified.
 */
public enum VerificationMode {
    /** Signature, expiry and a configured audience. */
    AUDIENCE_RESTRICTED,
    /** Signature and expiry only. */
    AUDIENCE_FREE
}

package com.example.slacksearch.auth;

import org.springframework.http.HttpStatus;

/**
 * Terminal outcomes of the gateway verification chain, each tied to the HTTP status and the
 * client-facing message rendered for it.
 */
public enum AuthFailure {
    FORBIDDEN_PATH(HttpStatus.FORBIDDEN, "Forbidden"),
    MISSING_ASSERTION(HttpStatus.UNAUTHORIZED, "Authentication required (IAP)"),
    INVALID_ASSERTION(HttpStatus.UNAUTHORIZED, "Authentication required (invalid IAP assertion)"),
    MISSING_CLAIM(HttpStatus.FORBIDDEN, "Email missing from identity"),
    MISSING_IMPERSONATION_TOKEN(HttpStatus.UNAUTHORIZED, "Authentication required (user ID token)"),
    INVALID_IMPERSONATION_TOKEN(HttpStatus.FORBIDDEN, "Invalid user ID token"),
    RATE_LIMITED(HttpStatus.TOO_MANY_REQUESTS, "Impersonation rate limit exceeded"),
    USER_NOT_FOUND(HttpStatus.FORBIDDEN, "User not recognized in Slack workspace"),
    UNAUTHORIZED(HttpStatus.FORBIDDEN, "Unauthorized access (Email Domain or Slack Workspace)"),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Security validation failed");

    private final HttpStatus status;
    private final String clientMessage;

    AuthFailure(HttpStatus status, String clientMessage) {
        this.status = status;
        this.clientMessage = clientMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getClientMessage() {
        return clientMessage;
    }
}

package com.example.slacksearch.auth;

import java.util.Objects;

/**
 * Outcome of one step of the verification chain: either a value or an {@link AuthFailure}.
 * The detail string is for logs only and must never carry credential material.
 */
public final class AuthResult<T> {

    private final T value;
    private final AuthFailure failure;
    private final String detail;

    private AuthResult(T value, AuthFailure failure, String detail) {
        this.value = value;
        this.failure = failure;
        this.detail = detail;
    }

    public static <T> AuthResult<T> ok(T value) {
        return new AuthResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> AuthResult<T> fail(AuthFailure failure, String detail) {
        return new AuthResult<>(null, Objects.requireNonNull(failure, "failure"), detail);
    }

    public boolean isOk() {
        return failure == null;
    }

    public T getValue() {
        if (failure != null) {
            throw new IllegalStateException("No value on failed result: " + failure);
        }
        return value;
    }

    public AuthFailure getFailure() {
        return failure;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * Re-types a failed result so it can be returned from a step with a different value type.
     */
    public <R> AuthResult<R> propagate() {
        if (isOk()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new AuthResult<>(null, failure, detail);
    }

    @Override
    public String toString() {
        return isOk() ? "AuthResult[ok]" : "AuthResult[" + failure + ": " + detail + "]";
    }
}

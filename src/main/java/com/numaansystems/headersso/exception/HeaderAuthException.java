package com.numaansystems.headersso.exception;

/**
 * Base class for failures raised while establishing identity from trusted
 * headers. The filter maps the {@link AuthFailureKind} to its policy.
 */
public abstract class HeaderAuthException extends RuntimeException {

    private final AuthFailureKind kind;

    protected HeaderAuthException(AuthFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected HeaderAuthException(AuthFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public AuthFailureKind getKind() {
        return kind;
    }
}

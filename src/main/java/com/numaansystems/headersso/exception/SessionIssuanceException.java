package com.numaansystems.headersso.exception;

/**
 * The session artifact for an authenticated user could not be issued.
 */
public class SessionIssuanceException extends HeaderAuthException {

    public SessionIssuanceException(String message, Throwable cause) {
        super(AuthFailureKind.SESSION_ISSUANCE, message, cause);
    }
}

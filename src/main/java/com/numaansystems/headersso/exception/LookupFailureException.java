package com.numaansystems.headersso.exception;

/**
 * User or role store unreachable or failing.
 */
public class LookupFailureException extends HeaderAuthException {

    public LookupFailureException(String message, Throwable cause) {
        super(AuthFailureKind.LOOKUP, message, cause);
    }
}

package com.numaansystems.headersso.exception;

/**
 * A new user record could not be persisted.
 */
public class ProvisioningException extends HeaderAuthException {

    public ProvisioningException(String message) {
        super(AuthFailureKind.PROVISIONING, message);
    }

    public ProvisioningException(String message, Throwable cause) {
        super(AuthFailureKind.PROVISIONING, message, cause);
    }
}

package com.numaansystems.headersso.exception;

/**
 * Thrown by the user store when a save violates the unique email constraint,
 * typically because a concurrent request provisioned the same user first.
 */
public class ProvisioningConflictException extends ProvisioningException {

    private final String email;

    public ProvisioningConflictException(String email, Throwable cause) {
        super("User already exists: " + email, cause);
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}

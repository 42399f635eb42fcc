package com.numaansystems.headersso.exception;

import jakarta.servlet.http.HttpServletResponse;

/**
 * Failure kinds the authentication filter distinguishes when applying the
 * failure policy.
 */
public enum AuthFailureKind {

    /** The default role for provisioning does not exist. */
    CONFIGURATION(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, true),

    /** The user or role store could not be queried. */
    LOOKUP(HttpServletResponse.SC_SERVICE_UNAVAILABLE, true),

    /** A new user could not be persisted. */
    PROVISIONING(HttpServletResponse.SC_SERVICE_UNAVAILABLE, true),

    /** The session artifact could not be issued. Never blocks a request. */
    SESSION_ISSUANCE(HttpServletResponse.SC_OK, false);

    private final int closedStatus;
    private final boolean closable;

    AuthFailureKind(int closedStatus, boolean closable) {
        this.closedStatus = closedStatus;
        this.closable = closable;
    }

    /**
     * Status sent to the client when this kind is configured fail-closed.
     */
    public int closedStatus() {
        return closedStatus;
    }

    /**
     * Whether a fail-closed policy may be applied to this kind.
     */
    public boolean isClosable() {
        return closable;
    }
}

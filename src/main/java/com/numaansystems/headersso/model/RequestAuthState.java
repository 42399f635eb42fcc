package com.numaansystems.headersso.model;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Objects;
import java.util.Optional;

/**
 * Authentication outcome attached to the current request.
 *
 * <p>Stored as a request attribute for downstream handlers. It lives and dies
 * with the request.</p>
 *
 * @param user      the resolved or provisioned user
 * @param assertion the raw header claims the user was resolved from
 */
public record RequestAuthState(UserRecord user, IdentityAssertion assertion) {

    /** Request attribute key. */
    public static final String ATTRIBUTE = RequestAuthState.class.getName();

    public RequestAuthState {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(assertion, "assertion");
    }

    /**
     * Attaches the state to the request unless one is already present.
     *
     * @return true if attached, false if the request already had a state
     */
    public boolean bindTo(HttpServletRequest request) {
        if (request.getAttribute(ATTRIBUTE) != null) {
            return false;
        }
        request.setAttribute(ATTRIBUTE, this);
        return true;
    }

    public static Optional<RequestAuthState> from(HttpServletRequest request) {
        Object value = request.getAttribute(ATTRIBUTE);
        return value instanceof RequestAuthState state ? Optional.of(state) : Optional.empty();
    }
}

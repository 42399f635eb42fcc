package com.numaansystems.headersso.model;

import java.io.Serializable;
import java.util.Locale;
import java.util.Optional;

/**
 * Identity claims read from the trusted proxy headers of a single request.
 *
 * <p>An assertion is never persisted. Blank values are normalized to
 * {@code null} so that callers only need to test for absence.</p>
 *
 * <h2>Resolution Key</h2>
 * <p>The primary email wins; the principal name (Azure AD UPN) is the
 * fallback. The chosen value is lower-cased before it is used for lookup
 * or provisioning.</p>
 *
 * @param primaryEmail          value of the forwarded email header
 * @param fallbackPrincipalName value of the principal name (UPN) header
 * @param externalObjectId      directory object id of the user, diagnostics only
 * @param displayName           display name, used to derive first and last name
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public record IdentityAssertion(String primaryEmail,
                                String fallbackPrincipalName,
                                String externalObjectId,
                                String displayName) implements Serializable {

    private static final IdentityAssertion EMPTY = new IdentityAssertion(null, null, null, null);

    public IdentityAssertion {
        primaryEmail = normalize(primaryEmail);
        fallbackPrincipalName = normalize(fallbackPrincipalName);
        externalObjectId = normalize(externalObjectId);
        displayName = normalize(displayName);
    }

    /**
     * Returns the assertion that carries no identity at all.
     *
     * @return the shared empty assertion
     */
    public static IdentityAssertion empty() {
        return EMPTY;
    }

    /**
     * Whether the assertion carries neither an email nor a principal name.
     *
     * @return true if there is nothing to resolve
     */
    public boolean isEmpty() {
        return primaryEmail == null && fallbackPrincipalName == null;
    }

    /**
     * Returns the lower-cased lookup key: the email, else the principal name.
     *
     * @return the resolution key, empty if {@link #isEmpty()}
     */
    public Optional<String> resolutionKey() {
        String key = primaryEmail != null ? primaryEmail : fallbackPrincipalName;
        return Optional.ofNullable(key).map(value -> value.toLowerCase(Locale.ROOT));
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}

package com.numaansystems.headersso.service;

import com.numaansystems.headersso.exception.LookupFailureException;
import com.numaansystems.headersso.model.IdentityAssertion;
import com.numaansystems.headersso.model.UserRecord;
import com.numaansystems.headersso.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maps an identity assertion to an existing user record.
 *
 * <p>The resolution key is the forwarded email, or the principal name (UPN)
 * when no email was sent, lower-cased. This service never writes.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class IdentityResolver {

    private static final Logger logger = LoggerFactory.getLogger(IdentityResolver.class);

    private final UserStore userStore;

    public IdentityResolver(UserStore userStore) {
        this.userStore = userStore;
    }

    /**
     * Looks up the user the assertion refers to.
     *
     * @param assertion the header claims
     * @return the user, empty if none exists or the assertion is empty
     * @throws LookupFailureException if the user store cannot be queried
     */
    public Optional<UserRecord> resolve(IdentityAssertion assertion) {
        Optional<String> key = assertion.resolutionKey();
        if (key.isEmpty()) {
            return Optional.empty();
        }

        String email = key.get();
        try {
            Optional<UserRecord> user = userStore.findByEmail(email, true);
            logger.debug("Resolved {} -> {}", email, user.map(UserRecord::getId).orElse("not found"));
            return user;
        } catch (DataAccessException e) {
            throw new LookupFailureException("User lookup failed for " + email, e);
        }
    }
}

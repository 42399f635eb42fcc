package com.numaansystems.headersso.service;

import com.numaansystems.headersso.config.HeaderAuthProperties;
import com.numaansystems.headersso.exception.LookupFailureException;
import com.numaansystems.headersso.exception.ProvisioningConflictException;
import com.numaansystems.headersso.exception.ProvisioningException;
import com.numaansystems.headersso.exception.RoleNotConfiguredException;
import com.numaansystems.headersso.model.IdentityAssertion;
import com.numaansystems.headersso.model.PersonName;
import com.numaansystems.headersso.model.UserRecord;
import com.numaansystems.headersso.store.RoleStore;
import com.numaansystems.headersso.store.UserStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Creates a user record the first time an unknown identity arrives.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Check that the configured default role exists (one query per attempt)</li>
 *   <li>Derive first and last name from the display name or email local part</li>
 *   <li>Create and save an enabled user with the lower-cased email and default role</li>
 * </ol>
 *
 * <h2>Concurrent Requests</h2>
 * <p>Two requests for the same new user can both get here. No lock is taken:
 * the store's unique email constraint rejects the second insert, and the
 * loser re-resolves and returns the winner's row.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Service
public class UserProvisioningService {

    private static final Logger logger = LoggerFactory.getLogger(UserProvisioningService.class);

    private final UserStore userStore;
    private final RoleStore roleStore;
    private final IdentityResolver identityResolver;
    private final HeaderAuthProperties.Provisioning policy;

    public UserProvisioningService(UserStore userStore,
                                   RoleStore roleStore,
                                   IdentityResolver identityResolver,
                                   HeaderAuthProperties properties) {
        this.userStore = userStore;
        this.roleStore = roleStore;
        this.identityResolver = identityResolver;
        this.policy = properties.provisioning();
    }

    public boolean isEnabled() {
        return policy.isEnabled();
    }

    /**
     * Provisions the user the assertion refers to.
     *
     * @param assertion a non-empty assertion that did not resolve
     * @return the persisted user
     * @throws RoleNotConfiguredException if the default role does not exist
     * @throws LookupFailureException     if the role store cannot be queried
     * @throws ProvisioningException      if the user cannot be saved
     */
    public UserRecord provision(IdentityAssertion assertion) {
        String email = assertion.resolutionKey()
                .orElseThrow(() -> new IllegalArgumentException("Assertion carries no identity"));
        String roleSlug = policy.defaultRole();

        logger.info("Auto-provisioning new user: {}", email);
        requireRole(roleSlug);

        PersonName name = PersonName.derive(assertion.displayName(), email);
        UserRecord user = userStore.create(email, name.firstName(), name.lastName(), roleSlug);

        try {
            UserRecord saved = userStore.save(user);
            logger.info("Created new user: {} (role: {})", email, roleSlug);
            return saved;
        } catch (ProvisioningConflictException e) {
            logger.info("User {} was provisioned concurrently, re-resolving", email);
            return reResolve(assertion, e);
        } catch (DataAccessException e) {
            throw new ProvisioningException("Failed to save user " + email, e);
        }
    }

    private void requireRole(String roleSlug) {
        boolean exists;
        try {
            exists = roleStore.existsBySlug(roleSlug);
        } catch (DataAccessException e) {
            throw new LookupFailureException("Role lookup failed for " + roleSlug, e);
        }
        if (!exists) {
            throw new RoleNotConfiguredException(roleSlug);
        }
    }

    private UserRecord reResolve(IdentityAssertion assertion, ProvisioningConflictException conflict) {
        Optional<UserRecord> existing = identityResolver.resolve(assertion);
        return existing.orElseThrow(() -> new ProvisioningException(
                "User " + conflict.getEmail() + " conflicted on save but could not be found", conflict));
    }
}

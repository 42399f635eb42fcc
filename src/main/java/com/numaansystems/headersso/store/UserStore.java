package com.numaansystems.headersso.store;

import com.numaansystems.headersso.exception.ProvisioningConflictException;
import com.numaansystems.headersso.model.UserRecord;

import java.util.Optional;

/**
 * Access to the host application's user records.
 *
 * <p>The store owns the user lifecycle and enforces email uniqueness. The
 * header authentication layer only reads users and creates new ones during
 * auto-provisioning.</p>
 *
 * <h2>Errors</h2>
 * <p>Implementations surface storage failures as Spring
 * {@link org.springframework.dao.DataAccessException}s, except for unique
 * email violations on save, which are reported as
 * {@link ProvisioningConflictException}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public interface UserStore {

    /**
     * Finds a user by exact (already lower-cased) email.
     *
     * @param email       the resolution key
     * @param includeRole whether to join the role relation
     * @return the user, empty if none
     */
    Optional<UserRecord> findByEmail(String email, boolean includeRole);

    /**
     * Builds an unsaved, enabled user. No storage access.
     */
    UserRecord create(String email, String firstName, String lastName, String roleSlug);

    /**
     * Persists the user and returns the stored record.
     *
     * @throws ProvisioningConflictException if another record already has the email
     */
    UserRecord save(UserRecord user);
}

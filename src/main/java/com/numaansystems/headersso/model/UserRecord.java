package com.numaansystems.headersso.model;

import java.io.Serial;
import java.io.Serializable;
import java.security.Principal;
import java.util.Objects;

/**
 * Application user as held by the user store.
 *
 * <p>Instances returned by {@code UserStore.create(...)} are unsaved and have
 * no id yet. The store assigns the id on save. Email uniqueness is enforced
 * by the store, not by this class.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class UserRecord implements Principal, Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private String id;
    private final String email;
    private final String firstName;
    private final String lastName;
    private final String roleSlug;
    private final boolean disabled;
    private final Role role;

    public UserRecord(String id, String email, String firstName, String lastName,
                      String roleSlug, boolean disabled, Role role) {
        this.id = id;
        this.email = Objects.requireNonNull(email, "email");
        this.firstName = firstName;
        this.lastName = lastName;
        this.roleSlug = roleSlug;
        this.disabled = disabled;
        this.role = role;
    }

    /**
     * Creates an unsaved, enabled user.
     */
    public static UserRecord unsaved(String email, String firstName, String lastName, String roleSlug) {
        return new UserRecord(null, email, firstName, lastName, roleSlug, false, null);
    }

    public String getId() {
        return id;
    }

    /**
     * Assigns the store generated id. Only the store calls this, once.
     */
    public void assignId(String id) {
        if (this.id != null) {
            throw new IllegalStateException("User " + email + " already has id " + this.id);
        }
        this.id = id;
    }

    public boolean isPersisted() {
        return id != null;
    }

    public String getEmail() {
        return email;
    }

    /**
     * Principal name used by Spring Security: the email.
     */
    @Override
    public String getName() {
        return email;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getRoleSlug() {
        return roleSlug;
    }

    public boolean isDisabled() {
        return disabled;
    }

    public Role getRole() {
        return role;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UserRecord other)) {
            return false;
        }
        return Objects.equals(id, other.id) && email.equals(other.email);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, email);
    }

    @Override
    public String toString() {
        return "UserRecord{" +
                "id='" + id + '\'' +
                ", email='" + email + '\'' +
                ", roleSlug='" + roleSlug + '\'' +
                ", disabled=" + disabled +
                '}';
    }
}

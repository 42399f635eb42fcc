package com.numaansystems.headersso.exception;

/**
 * The configured default role for auto-provisioning does not exist in the
 * role store.
 */
public class RoleNotConfiguredException extends HeaderAuthException {

    private final String roleSlug;

    public RoleNotConfiguredException(String roleSlug) {
        super(AuthFailureKind.CONFIGURATION, "Default role not found: " + roleSlug);
        this.roleSlug = roleSlug;
    }

    public String getRoleSlug() {
        return roleSlug;
    }
}

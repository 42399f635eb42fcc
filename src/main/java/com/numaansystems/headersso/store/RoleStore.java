package com.numaansystems.headersso.store;

/**
 * Read access to the host application's roles.
 */
public interface RoleStore {

    /**
     * Single existence query for a role slug.
     *
     * @param slug the role slug, e.g. {@code global:member}
     * @return true if the role exists
     */
    boolean existsBySlug(String slug);
}

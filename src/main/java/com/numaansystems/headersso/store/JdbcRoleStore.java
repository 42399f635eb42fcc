package com.numaansystems.headersso.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * {@link RoleStore} backed by the {@code app_role} table.
 *
 * <pre>
 * CREATE TABLE app_role (
 *     slug VARCHAR(128) PRIMARY KEY,
 *     display_name VARCHAR(255) NOT NULL
 * );
 * </pre>
 */
@Repository
public class JdbcRoleStore implements RoleStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcRoleStore.class);

    private static final String EXISTS_SQL = "SELECT slug FROM app_role WHERE slug = ? LIMIT 1";

    private final JdbcTemplate jdbcTemplate;

    public JdbcRoleStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean existsBySlug(String slug) {
        List<String> slugs = jdbcTemplate.queryForList(EXISTS_SQL, String.class, slug);
        logger.debug("Role {} exists: {}", slug, !slugs.isEmpty());
        return !slugs.isEmpty();
    }
}

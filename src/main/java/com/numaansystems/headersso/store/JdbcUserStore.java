package com.numaansystems.headersso.store;

import com.numaansystems.headersso.exception.ProvisioningConflictException;
import com.numaansystems.headersso.model.Role;
import com.numaansystems.headersso.model.UserRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link UserStore} implementation using Spring JDBC.
 *
 * <h2>Database Schema</h2>
 * <pre>
 * CREATE TABLE app_user (
 *     id VARCHAR(36) PRIMARY KEY,
 *     email VARCHAR(255) NOT NULL,
 *     first_name VARCHAR(128),
 *     last_name VARCHAR(128),
 *     role_slug VARCHAR(128) NOT NULL,
 *     disabled BOOLEAN DEFAULT false NOT NULL,
 *     CONSTRAINT uq_app_user_email UNIQUE (email),
 *     FOREIGN KEY (role_slug) REFERENCES app_role(slug)
 * );
 * </pre>
 *
 * <p>The unique constraint on {@code email} is what makes concurrent
 * auto-provisioning safe: the losing insert fails with a duplicate key and is
 * reported as {@link ProvisioningConflictException}.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Repository
public class JdbcUserStore implements UserStore {

    private static final Logger logger = LoggerFactory.getLogger(JdbcUserStore.class);

    private static final String FIND_SQL = """
            SELECT u.id, u.email, u.first_name, u.last_name, u.role_slug, u.disabled
            FROM app_user u
            WHERE u.email = ?
            """;

    private static final String FIND_WITH_ROLE_SQL = """
            SELECT u.id, u.email, u.first_name, u.last_name, u.role_slug, u.disabled,
                   r.display_name AS role_display_name
            FROM app_user u
            LEFT JOIN app_role r ON r.slug = u.role_slug
            WHERE u.email = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO app_user (id, email, first_name, last_name, role_slug, disabled)
            VALUES (?, ?, ?, ?, ?, ?)
            """;

    private static final String UPDATE_SQL = """
            UPDATE app_user
            SET first_name = ?, last_name = ?, role_slug = ?, disabled = ?
            WHERE id = ?
            """;

    private final JdbcTemplate jdbcTemplate;

    public JdbcUserStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<UserRecord> findByEmail(String email, boolean includeRole) {
        String sql = includeRole ? FIND_WITH_ROLE_SQL : FIND_SQL;
        List<UserRecord> users = jdbcTemplate.query(sql, userMapper(includeRole), email);
        logger.debug("Lookup for {} returned {} row(s)", email, users.size());
        return users.stream().findFirst();
    }

    @Override
    public UserRecord create(String email, String firstName, String lastName, String roleSlug) {
        return UserRecord.unsaved(email, firstName, lastName, roleSlug);
    }

    @Override
    public UserRecord save(UserRecord user) {
        if (user.isPersisted()) {
            jdbcTemplate.update(UPDATE_SQL, user.getFirstName(), user.getLastName(),
                    user.getRoleSlug(), user.isDisabled(), user.getId());
            return user;
        }

        String id = UUID.randomUUID().toString();
        try {
            jdbcTemplate.update(INSERT_SQL, id, user.getEmail(), user.getFirstName(),
                    user.getLastName(), user.getRoleSlug(), user.isDisabled());
        } catch (DuplicateKeyException e) {
            throw new ProvisioningConflictException(user.getEmail(), e);
        }

        user.assignId(id);
        logger.info("Inserted user {} with id {}", user.getEmail(), id);
        return user;
    }

    private static RowMapper<UserRecord> userMapper(boolean includeRole) {
        return (rs, rowNum) -> {
            String roleSlug = rs.getString("role_slug");
            Role role = null;
            if (includeRole) {
                String displayName = rs.getString("role_display_name");
                role = displayName != null ? new Role(roleSlug, displayName) : null;
            }
            return new UserRecord(
                    rs.getString("id"),
                    rs.getString("email"),
                    rs.getString("first_name"),
                    rs.getString("last_name"),
                    roleSlug,
                    rs.getBoolean("disabled"),
                    role);
        };
    }
}

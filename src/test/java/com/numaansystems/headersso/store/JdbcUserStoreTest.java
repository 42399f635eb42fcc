package com.numaansystems.headersso.store;

import com.numaansystems.headersso.exception.ProvisioningConflictException;
import com.numaansystems.headersso.model.UserRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests JdbcUserStore and JdbcRoleStore against an in-memory H2 database.
 */
class JdbcUserStoreTest {

    private EmbeddedDatabase database;
    private JdbcTemplate jdbcTemplate;
    private JdbcUserStore userStore;
    private JdbcRoleStore roleStore;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
                .generateUniqueName(true)
                .setType(EmbeddedDatabaseType.H2)
                .addScripts("schema.sql", "data.sql")
                .build();
        jdbcTemplate = new JdbcTemplate(database);
        userStore = new JdbcUserStore(jdbcTemplate);
        roleStore = new JdbcRoleStore(jdbcTemplate);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    @DisplayName("Should find an existing user with its role")
    void testFindWithRole() {
        Optional<UserRecord> user = userStore.findByEmail("existing@example.com", true);

        assertTrue(user.isPresent());
        assertEquals("00000000-0000-0000-0000-000000000001", user.get().getId());
        assertEquals("global:admin", user.get().getRoleSlug());
        assertNotNull(user.get().getRole());
        assertEquals("global:admin", user.get().getRole().slug());
        assertFalse(user.get().isDisabled());
    }

    @Test
    @DisplayName("Should find a user without joining the role")
    void testFindWithoutRole() {
        Optional<UserRecord> user = userStore.findByEmail("disabled@example.com", false);

        assertTrue(user.isPresent());
        assertNull(user.get().getRole());
        assertTrue(user.get().isDisabled());
    }

    @Test
    @DisplayName("Should return empty for an unknown email")
    void testFindUnknown() {
        assertTrue(userStore.findByEmail("nobody@example.com", true).isEmpty());
    }

    @Test
    @DisplayName("Should assign an id when saving a new user")
    void testSaveNewUser() {
        // Arrange
        UserRecord user = userStore.create("grace@example.com", "Grace", "Hopper", "global:member");
        assertFalse(user.isPersisted());

        // Act
        UserRecord saved = userStore.save(user);

        // Assert
        assertTrue(saved.isPersisted());
        UserRecord reloaded = userStore.findByEmail("grace@example.com", true).orElseThrow();
        assertEquals(saved.getId(), reloaded.getId());
        assertEquals("Grace", reloaded.getFirstName());
        assertEquals("Hopper", reloaded.getLastName());
        assertEquals("global:member", reloaded.getRoleSlug());
    }

    @Test
    @DisplayName("Should update an already persisted user")
    void testSaveExistingUser() {
        // Arrange
        UserRecord existing = userStore.findByEmail("disabled@example.com", false).orElseThrow();
        UserRecord enabled = new UserRecord(existing.getId(), existing.getEmail(), "Re", "Enabled",
                existing.getRoleSlug(), false, null);

        // Act
        userStore.save(enabled);

        // Assert
        UserRecord reloaded = userStore.findByEmail("disabled@example.com", false).orElseThrow();
        assertFalse(reloaded.isDisabled());
        assertEquals("Re", reloaded.getFirstName());
    }

    @Test
    @DisplayName("Should raise a conflict for a duplicate email")
    void testDuplicateEmail() {
        // Arrange
        UserRecord duplicate = userStore.create("existing@example.com", "Dup", "", "global:member");

        // Act
        ProvisioningConflictException thrown =
                assertThrows(ProvisioningConflictException.class, () -> userStore.save(duplicate));

        // Assert
        assertEquals("existing@example.com", thrown.getEmail());
        assertFalse(duplicate.isPersisted());
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM app_user WHERE email = ?", Integer.class, "existing@example.com");
        assertEquals(1, count);
    }

    @Test
    @DisplayName("Should report whether a role exists")
    void testRoleExists() {
        assertTrue(roleStore.existsBySlug("global:member"));
        assertFalse(roleStore.existsBySlug("global:missing"));
    }
}

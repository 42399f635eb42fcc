package com.numaansystems.headersso;

import com.numaansystems.headersso.filter.TrustedHeaderAuthenticationFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.mock.web.MockHttpSession;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.user;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * End-to-end tests of header authentication through the security filter
 * chain, against an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
class HeaderSsoApplicationTests {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private TrustedHeaderAuthenticationFilter trustedHeaderAuthenticationFilter;

    private int countUsers(String email) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM app_user WHERE email = ?", Integer.class, email);
        return count == null ? 0 : count;
    }

    @Test
    @DisplayName("Should load the application context")
    void contextLoads() {
        assertNotNull(trustedHeaderAuthenticationFilter);
    }

    @Test
    @DisplayName("Should authenticate an existing user from headers")
    void testExistingUser() throws Exception {
        mockMvc.perform(get("/api/me")
                        .header("X-Forwarded-Email", "Existing@Example.com")
                        .header("X-Forwarded-User", "Existing User"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.authenticated").value(true))
                .andExpect(jsonPath("$.id").value("00000000-0000-0000-0000-000000000001"))
                .andExpect(jsonPath("$.email").value("existing@example.com"))
                .andExpect(jsonPath("$.role").value("global:admin"))
                .andExpect(jsonPath("$.source").value("headers"))
                .andExpect(jsonPath("$.displayName").value("Existing User"));
    }

    @Test
    @DisplayName("Should auto-provision an unknown user")
    void testAutoProvision() throws Exception {
        // Arrange
        assertEquals(0, countUsers("grace.hopper@example.com"));

        // Act & Assert
        mockMvc.perform(get("/api/me")
                        .header("x-forwarded-email", "Grace.Hopper@Example.com")
                        .header("x-forwarded-user", "Grace Hopper")
                        .header("x-ms-client-principal-id", "oid-grace"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("grace.hopper@example.com"))
                .andExpect(jsonPath("$.firstName").value("Grace"))
                .andExpect(jsonPath("$.lastName").value("Hopper"))
                .andExpect(jsonPath("$.role").value("global:member"))
                .andExpect(jsonPath("$.objectId").value("oid-grace"));

        assertEquals(1, countUsers("grace.hopper@example.com"));
    }

    @Test
    @DisplayName("Should provision from the principal name when no email is sent")
    void testPrincipalNameFallback() throws Exception {
        mockMvc.perform(get("/api/me")
                        .header("x-ms-client-principal-name", "UPN.User@Corp.Example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("upn.user@corp.example.com"))
                .andExpect(jsonPath("$.firstName").value("upn.user"))
                .andExpect(jsonPath("$.lastName").value(""))
                .andExpect(jsonPath("$.upn").value("UPN.User@Corp.Example.com"));

        assertEquals(1, countUsers("upn.user@corp.example.com"));
    }

    @Test
    @DisplayName("Should reject protected paths without identity headers")
    void testNoHeaders() throws Exception {
        mockMvc.perform(get("/api/me"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should not authenticate a disabled user")
    void testDisabledUser() throws Exception {
        mockMvc.perform(get("/api/me").header("x-forwarded-email", "disabled@example.com"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("Should restore the user from the session without headers")
    void testSessionReuse() throws Exception {
        // Arrange
        MvcResult first = mockMvc.perform(get("/api/me")
                        .header("x-forwarded-email", "session.user@example.com")
                        .header("browser-id", "browser-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.source").value("headers"))
                .andReturn();
        MockHttpSession session = (MockHttpSession) first.getRequest().getSession(false);
        assertNotNull(session);

        // Act & Assert
        mockMvc.perform(get("/api/me").session(session))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("session.user@example.com"))
                .andExpect(jsonPath("$.source").value("session"));
    }

    @Test
    @DisplayName("Should keep the session user even when other headers arrive")
    void testSessionWinsOverHeaders() throws Exception {
        // Arrange
        MvcResult first = mockMvc.perform(get("/api/me").header("x-forwarded-email", "first.login@example.com"))
                .andExpect(status().isOk())
                .andReturn();
        MockHttpSession session = (MockHttpSession) first.getRequest().getSession(false);

        // Act & Assert
        mockMvc.perform(get("/api/me")
                        .session(session)
                        .header("x-forwarded-email", "second.identity@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("first.login@example.com"));

        assertEquals(0, countUsers("second.identity@example.com"));
    }

    @Test
    @DisplayName("Should not resolve headers for a request authenticated by another mechanism")
    void testOtherAuthenticationUntouched() throws Exception {
        mockMvc.perform(get("/api/me")
                        .with(user("form.user@example.com"))
                        .header("x-forwarded-email", "header.user@example.com"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.authenticated").value(false));

        assertEquals(0, countUsers("header.user@example.com"));
    }

    @Test
    @DisplayName("Should not provision on exempt paths")
    void testHealthSkipsAuthentication() throws Exception {
        mockMvc.perform(get("/healthz").header("x-forwarded-email", "health.probe@example.com"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.service").value("header-sso"))
                .andExpect(jsonPath("$.headerAuth").value(true))
                .andExpect(jsonPath("$.provisioning").value(true));

        assertEquals(0, countUsers("health.probe@example.com"));
    }
}

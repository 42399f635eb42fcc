package com.numaansystems.headersso.filter;

import com.numaansystems.headersso.config.HeaderAuthProperties;
import com.numaansystems.headersso.model.IdentityAssertion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TrustedHeaderExtractor.
 */
class TrustedHeaderExtractorTest {

    private TrustedHeaderExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new TrustedHeaderExtractor(HeaderAuthProperties.defaults().headers());
    }

    @Test
    @DisplayName("Should read all identity headers from the request")
    void testExtractFromRequest() {
        // Arrange
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/home");
        request.addHeader("X-Forwarded-Email", "grace.hopper@example.com");
        request.addHeader("X-MS-CLIENT-PRINCIPAL-NAME", "ghopper@corp.example.com");
        request.addHeader("X-MS-CLIENT-PRINCIPAL-ID", "4f1c1e52-0000-0000-0000-000000000000");
        request.addHeader("X-Forwarded-User", "Grace Hopper");

        // Act
        IdentityAssertion assertion = extractor.extract(request);

        // Assert
        assertEquals("grace.hopper@example.com", assertion.primaryEmail());
        assertEquals("ghopper@corp.example.com", assertion.fallbackPrincipalName());
        assertEquals("4f1c1e52-0000-0000-0000-000000000000", assertion.externalObjectId());
        assertEquals("Grace Hopper", assertion.displayName());
    }

    @Test
    @DisplayName("Should match header names case-insensitively in a plain map")
    void testExtractFromMap() {
        IdentityAssertion assertion = extractor.extract(Map.of(
                "x-FORWARDED-email", "Alice@Example.com",
                "X-Forwarded-User", "Alice Liddell"));

        assertEquals("Alice@Example.com", assertion.primaryEmail());
        assertEquals("Alice Liddell", assertion.displayName());
        assertEquals("alice@example.com", assertion.resolutionKey().orElseThrow());
    }

    @Test
    @DisplayName("Should accept the principal name alone")
    void testPrincipalNameOnly() {
        IdentityAssertion assertion = extractor.extract(Map.of("x-ms-client-principal-name", "UPN@Corp.Example.com"));

        assertFalse(assertion.isEmpty());
        assertNull(assertion.primaryEmail());
        assertEquals("upn@corp.example.com", assertion.resolutionKey().orElseThrow());
    }

    @Test
    @DisplayName("Should return an empty assertion without email or principal name")
    void testNoIdentity() {
        IdentityAssertion assertion = extractor.extract(Map.of(
                "x-forwarded-user", "Nobody",
                "x-ms-client-principal-id", "oid"));

        assertTrue(assertion.isEmpty());
        assertSame(IdentityAssertion.empty(), assertion);
    }

    @Test
    @DisplayName("Should use the configured email header name")
    void testConfiguredEmailHeader() {
        TrustedHeaderExtractor custom = new TrustedHeaderExtractor(
                new HeaderAuthProperties.Headers("X-Auth-Request-Email", null, null, null, null));

        IdentityAssertion fromCustom = custom.extract(Map.of("x-auth-request-email", "carol@example.com"));
        IdentityAssertion ignoredDefault = custom.extract(Map.of("x-forwarded-email", "carol@example.com"));

        assertEquals("carol@example.com", fromCustom.primaryEmail());
        assertTrue(ignoredDefault.isEmpty());
    }
}

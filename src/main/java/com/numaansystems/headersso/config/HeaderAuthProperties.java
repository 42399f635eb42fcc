package com.numaansystems.headersso.config;

import com.numaansystems.headersso.exception.AuthFailureKind;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration of the trusted-header authentication layer.
 *
 * <p>Bound once at startup from {@code header-auth.*} and passed by
 * constructor injection to every component. Unset values fall back to the
 * defaults below, so {@link #defaults()} and an empty configuration are
 * equivalent.</p>
 *
 * <h2>Example</h2>
 * <pre>
 * header-auth:
 *   debug: false
 *   headers:
 *     email: x-forwarded-email
 *   provisioning:
 *     enabled: true
 *     default-role: global:member
 *   session:
 *     mode: http-session
 *   failure-policy:
 *     lookup: closed
 * </pre>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Validated
@ConfigurationProperties(prefix = "header-auth")
public record HeaderAuthProperties(
        Boolean enabled,
        Boolean debug,
        @Valid Headers headers,
        @Valid Provisioning provisioning,
        @Valid Skip skip,
        @Valid Session session,
        Map<AuthFailureKind, FailureMode> failurePolicy
) {

    public static final List<String> DEFAULT_SKIP_PATHS = List.of(
            "/healthz",
            "/healthcheck",
            "/metrics",
            "/webhook",
            "/webhook-test",
            "/webhook-waiting",
            "/rest/oauth2-credential",
            "/assets",
            "/static",
            "/favicon.ico",
            "/rest/settings",
            "/rest/sso",
            "/rest/login",
            "/rest/logout",
            "/rest/mfa",
            "/rest/forgot-password",
            "/rest/resolve-signup-token",
            "/rest/signup"
    );

    public static final List<String> DEFAULT_SKIP_EXTENSIONS = List.of(
            "js", "css", "png", "jpg", "jpeg", "gif", "ico", "svg", "woff", "woff2", "ttf", "eot", "map"
    );

    public HeaderAuthProperties {
        enabled = enabled == null || enabled;
        debug = debug != null && debug;
        headers = headers != null ? headers : new Headers(null, null, null, null, null);
        provisioning = provisioning != null ? provisioning : new Provisioning(null, null);
        skip = skip != null ? skip : new Skip(null, null);
        session = session != null ? session : new Session(null);
        failurePolicy = failurePolicy == null || failurePolicy.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(failurePolicy));
    }

    /**
     * All defaults: provisioning on with {@code global:member}, HTTP session
     * issuance, every failure kind fail-open.
     */
    public static HeaderAuthProperties defaults() {
        return new HeaderAuthProperties(null, null, null, null, null, null, null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Looks up the configured mode for a failure kind. Kinds that cannot be
     * closed, or that are not configured, are always {@link FailureMode#OPEN}.
     */
    public FailureMode failureModeFor(AuthFailureKind kind) {
        if (!kind.isClosable()) {
            return FailureMode.OPEN;
        }
        return failurePolicy.getOrDefault(kind, FailureMode.OPEN);
    }

    /**
     * Names of the trusted headers set by the proxy.
     */
    public record Headers(@NotBlank String email,
                          String upn,
                          String objectId,
                          String displayName,
                          String browserId) {

        public Headers {
            email = orDefault(email, "x-forwarded-email");
            upn = orDefault(upn, "x-ms-client-principal-name");
            objectId = orDefault(objectId, "x-ms-client-principal-id");
            displayName = orDefault(displayName, "x-forwarded-user");
            browserId = orDefault(browserId, "browser-id");
        }
    }

    /**
     * Auto-provisioning policy. The default role is validated on every
     * provisioning attempt, not here.
     */
    public record Provisioning(Boolean enabled, @NotBlank String defaultRole) {

        public Provisioning {
            enabled = enabled == null || enabled;
            defaultRole = orDefault(defaultRole, "global:member");
        }

        public boolean isEnabled() {
            return enabled;
        }
    }

    /**
     * Paths and file extensions that are never authenticated from headers.
     */
    public record Skip(@NotNull List<String> paths, @NotNull List<String> extensions) {

        public Skip {
            paths = paths != null ? List.copyOf(paths) : DEFAULT_SKIP_PATHS;
            extensions = extensions != null ? List.copyOf(extensions) : DEFAULT_SKIP_EXTENSIONS;
        }
    }

    public record Session(SessionMode mode) {

        public Session {
            mode = mode != null ? mode : SessionMode.HTTP_SESSION;
        }
    }

    public enum SessionMode {
        /** Only the current request is authenticated. */
        NONE,
        /** The security context is saved into the servlet HTTP session. */
        HTTP_SESSION
    }

    public enum FailureMode {
        /** Log and continue the request unauthenticated. */
        OPEN,
        /** Reject the request with the failure kind's status. */
        CLOSED
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}

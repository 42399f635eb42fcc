package com.numaansystems.headersso.filter;

import com.numaansystems.headersso.config.HeaderAuthProperties;
import com.numaansystems.headersso.config.HeaderAuthProperties.FailureMode;
import com.numaansystems.headersso.exception.HeaderAuthException;
import com.numaansystems.headersso.model.IdentityAssertion;
import com.numaansystems.headersso.model.RequestAuthState;
import com.numaansystems.headersso.model.UserRecord;
import com.numaansystems.headersso.service.IdentityResolver;
import com.numaansystems.headersso.service.UserProvisioningService;
import com.numaansystems.headersso.session.SessionEstablisher;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.UrlPathHelper;

import java.io.IOException;
import java.util.Collections;
import java.util.Locale;
import java.util.Optional;

/**
 * Authenticates requests from the identity headers of a trusted proxy
 * (e.g. Azure AD Application Proxy).
 *
 * <p>This filter is installed in the Spring Security chain right after the
 * security context is loaded, ahead of every other authentication filter and
 * of all application handlers. It never blocks a request by default: the
 * request always continues, authenticated or not, and authorization is left
 * to the rest of the chain.</p>
 *
 * <h2>Sequence</h2>
 * <ol>
 *   <li>Skip exempt paths (health, webhooks, login/logout/MFA, static files)</li>
 *   <li>Skip requests that are already authenticated, e.g. from the HTTP session</li>
 *   <li>Read the email or UPN header; skip if neither was sent</li>
 *   <li>Look up the user; on a miss provision it if enabled</li>
 *   <li>Attach the user to the request and issue a session</li>
 * </ol>
 *
 * <h2>Failures</h2>
 * <p>Failures of steps 4 and 5 are mapped through the configured failure
 * policy. With the default (open) policy they are logged and the request
 * proceeds unauthenticated. A closed policy answers with the failure kind's
 * status instead. Exceptions thrown further down the chain are not caught.</p>
 *
 * <h2>Security Note</h2>
 * <p>Headers are trusted as-is. The application must only be reachable
 * through the proxy, otherwise identities can be spoofed.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class TrustedHeaderAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TrustedHeaderAuthenticationFilter.class);

    private final HeaderAuthProperties properties;
    private final SkipPathClassifier skipPathClassifier;
    private final TrustedHeaderExtractor headerExtractor;
    private final IdentityResolver identityResolver;
    private final UserProvisioningService provisioningService;
    private final SessionEstablisher sessionEstablisher;
    private final UrlPathHelper urlPathHelper = new UrlPathHelper();

    public TrustedHeaderAuthenticationFilter(HeaderAuthProperties properties,
                                             SkipPathClassifier skipPathClassifier,
                                             TrustedHeaderExtractor headerExtractor,
                                             IdentityResolver identityResolver,
                                             UserProvisioningService provisioningService,
                                             SessionEstablisher sessionEstablisher) {
        this.properties = properties;
        this.skipPathClassifier = skipPathClassifier;
        this.headerExtractor = headerExtractor;
        this.identityResolver = identityResolver;
        this.provisioningService = provisioningService;
        this.sessionEstablisher = sessionEstablisher;
    }

    @Override
    protected void initFilterBean() {
        if (!properties.isEnabled()) {
            log.info("Header-based SSO disabled");
            return;
        }
        HeaderAuthProperties.Headers headers = properties.headers();
        log.info("Auto-provisioning: {}, default role: {}",
                provisioningService.isEnabled() ? "enabled" : "disabled",
                properties.provisioning().defaultRole());
        log.info("Header-based SSO enabled. Primary header: {}, fallback: {}, session: {}",
                headers.email(), headers.upn(), properties.session().mode());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (!properties.isEnabled()) {
            return true;
        }
        String path = urlPathHelper.getPathWithinApplication(request);
        boolean skip = skipPathClassifier.shouldSkip(path);
        if (skip) {
            log.debug("Skipping header authentication for {}", path);
        }
        return skip;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        if (!isAlreadyAuthenticated(request)) {
            try {
                authenticate(request, response);
            } catch (HeaderAuthException e) {
                if (properties.failureModeFor(e.getKind()) == FailureMode.CLOSED) {
                    log.error("Header authentication failed ({}), rejecting request: {}",
                            e.getKind(), e.getMessage(), e);
                    response.sendError(e.getKind().closedStatus(), "Identity could not be established");
                    return;
                }
                log.error("Header authentication failed ({}), continuing unauthenticated: {}",
                        e.getKind(), e.getMessage(), e);
            } catch (RuntimeException e) {
                log.error("Authentication error, continuing unauthenticated", e);
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, HttpServletResponse response) {
        if (properties.isDebug()) {
            logIdentityHeaders(request);
        }

        IdentityAssertion assertion = headerExtractor.extract(request);
        if (assertion.isEmpty()) {
            log.debug("No identity headers on {}", request.getRequestURI());
            return;
        }
        String email = assertion.resolutionKey().orElseThrow();

        Optional<UserRecord> user = identityResolver.resolve(assertion);
        if (user.isEmpty()) {
            if (!provisioningService.isEnabled()) {
                log.info("User not found for email: {} (objectId: {})",
                        email, Optional.ofNullable(assertion.externalObjectId()).orElse("N/A"));
                return;
            }
            user = Optional.of(provisioningService.provision(assertion));
        }

        UserRecord resolved = user.get();
        if (resolved.isDisabled()) {
            log.warn("User {} is disabled, not authenticating", email);
            return;
        }

        if (sessionEstablisher.establish(request, response, resolved, assertion)) {
            log.info("Authenticated user: {} ({})",
                    email, Optional.ofNullable(assertion.displayName()).orElse("N/A"));
        }
    }

    private boolean isAlreadyAuthenticated(HttpServletRequest request) {
        if (RequestAuthState.from(request).isPresent()) {
            return true;
        }
        Authentication existing = SecurityContextHolder.getContext().getAuthentication();
        return existing != null
                && existing.isAuthenticated()
                && !(existing instanceof AnonymousAuthenticationToken);
    }

    private void logIdentityHeaders(HttpServletRequest request) {
        log.info("SSO debug path: {}", urlPathHelper.getPathWithinApplication(request));
        for (String name : Collections.list(request.getHeaderNames())) {
            String lower = name.toLowerCase(Locale.ROOT);
            if (lower.startsWith("x-") || lower.contains("forward") || lower.contains("auth")) {
                boolean secret = lower.contains("token") || lower.equals("authorization");
                String value = secret ? "***" : request.getHeader(name);
                log.info("SSO debug header: {}={}", lower, value);
            }
        }
    }
}

package com.numaansystems.headersso.session;

import com.numaansystems.headersso.model.IdentityAssertion;
import com.numaansystems.headersso.model.RequestAuthState;
import com.numaansystems.headersso.model.UserRecord;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.List;

/**
 * Marks the current request as authenticated for a resolved user and issues
 * a session for later requests.
 *
 * <p>The request gets a {@link RequestAuthState} attribute and a Spring
 * Security {@link org.springframework.security.core.Authentication} whose
 * principal is the {@link UserRecord} and whose single authority is the
 * user's role slug. Session issuance through the {@link SessionIssuer} is
 * best-effort: failures are logged and the current request stays
 * authenticated.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class SessionEstablisher {

    private static final Logger logger = LoggerFactory.getLogger(SessionEstablisher.class);

    private final SessionIssuer sessionIssuer;
    private final String browserIdHeader;

    public SessionEstablisher(SessionIssuer sessionIssuer, String browserIdHeader) {
        this.sessionIssuer = sessionIssuer;
        this.browserIdHeader = browserIdHeader;
    }

    /**
     * Authenticates the current request as {@code user}.
     *
     * @return false if the request already carried an auth state, which is left untouched
     */
    public boolean establish(HttpServletRequest request, HttpServletResponse response,
                             UserRecord user, IdentityAssertion assertion) {
        if (!new RequestAuthState(user, assertion).bindTo(request)) {
            logger.debug("Request already carries an authenticated user, not overwriting");
            return false;
        }

        List<GrantedAuthority> authorities = user.getRoleSlug() != null
                ? List.of(new SimpleGrantedAuthority(user.getRoleSlug()))
                : List.of();
        UsernamePasswordAuthenticationToken authentication =
                UsernamePasswordAuthenticationToken.authenticated(user, null, authorities);
        authentication.setDetails(assertion);

        SecurityContext context = SecurityContextHolder.createEmptyContext();
        context.setAuthentication(authentication);
        SecurityContextHolder.setContext(context);

        try {
            sessionIssuer.issue(request, response, user, request.getHeader(browserIdHeader));
        } catch (RuntimeException e) {
            logger.warn("Could not issue session for {}: {}", user.getEmail(), e.getMessage());
        }
        return true;
    }
}

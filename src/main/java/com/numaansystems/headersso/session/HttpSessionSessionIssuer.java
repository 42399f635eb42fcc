package com.numaansystems.headersso.session;

import com.numaansystems.headersso.exception.SessionIssuanceException;
import com.numaansystems.headersso.model.UserRecord;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.context.SecurityContextRepository;

/**
 * Persists the authenticated security context in the servlet HTTP session.
 *
 * <p>The container's session cookie becomes the session artifact. On the
 * next request Spring Security restores the context from the session and the
 * header filter sees an already authenticated request.</p>
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>An existing session id is rotated before the user is stored</li>
 *   <li>The context is saved through the same {@link SecurityContextRepository}
 *       the security filter chain loads from</li>
 *   <li>The browser id, if sent, is kept as session attribute
 *       {@value #BROWSER_ID_ATTRIBUTE}</li>
 * </ul>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class HttpSessionSessionIssuer implements SessionIssuer {

    public static final String BROWSER_ID_ATTRIBUTE = "header-auth.browser-id";

    private static final Logger logger = LoggerFactory.getLogger(HttpSessionSessionIssuer.class);

    private final SecurityContextRepository securityContextRepository;

    public HttpSessionSessionIssuer(SecurityContextRepository securityContextRepository) {
        this.securityContextRepository = securityContextRepository;
    }

    @Override
    public void issue(HttpServletRequest request, HttpServletResponse response, UserRecord user, String browserId) {
        try {
            if (request.getSession(false) != null) {
                request.changeSessionId();
            }

            securityContextRepository.saveContext(SecurityContextHolder.getContext(), request, response);

            if (browserId != null && !browserId.isBlank()) {
                request.getSession().setAttribute(BROWSER_ID_ATTRIBUTE, browserId);
            }
            logger.debug("Stored security context for {} in HTTP session", user.getEmail());
        } catch (IllegalStateException e) {
            throw new SessionIssuanceException("Could not store session for " + user.getEmail(), e);
        }
    }
}

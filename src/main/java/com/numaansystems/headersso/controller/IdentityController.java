package com.numaansystems.headersso.controller;

import com.numaansystems.headersso.model.IdentityAssertion;
import com.numaansystems.headersso.model.RequestAuthState;
import com.numaansystems.headersso.model.UserRecord;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shows which user the current request is authenticated as.
 *
 * <p>Reads the {@link RequestAuthState} left by the header filter, or the
 * principal restored from the HTTP session on later requests.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@RestController
@RequestMapping("/api")
public class IdentityController {

    private static final Logger logger = LoggerFactory.getLogger(IdentityController.class);

    @GetMapping("/me")
    public ResponseEntity<Map<String, Object>> me(HttpServletRequest request, Authentication authentication) {
        Optional<RequestAuthState> state = RequestAuthState.from(request);

        UserRecord user;
        if (state.isPresent()) {
            user = state.get().user();
        } else if (authentication != null && authentication.getPrincipal() instanceof UserRecord principal) {
            user = principal;
        } else {
            logger.debug("No authenticated user on {}", request.getRequestURI());
            Map<String, Object> errorResponse = new HashMap<>();
            errorResponse.put("authenticated", false);
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(errorResponse);
        }

        Map<String, Object> body = new HashMap<>();
        body.put("authenticated", true);
        body.put("id", user.getId());
        body.put("email", user.getEmail());
        body.put("firstName", user.getFirstName());
        body.put("lastName", user.getLastName());
        body.put("role", user.getRoleSlug());
        body.put("source", state.isPresent() ? "headers" : "session");

        state.map(RequestAuthState::assertion).ifPresent(assertion -> addAssertion(body, assertion));
        return ResponseEntity.ok(body);
    }

    private static void addAssertion(Map<String, Object> body, IdentityAssertion assertion) {
        body.put("upn", assertion.fallbackPrincipalName());
        body.put("objectId", assertion.externalObjectId());
        body.put("displayName", assertion.displayName());
    }
}

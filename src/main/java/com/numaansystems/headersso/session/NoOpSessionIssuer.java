package com.numaansystems.headersso.session;

import com.numaansystems.headersso.model.UserRecord;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Issues nothing. Only the current request is authenticated, and every
 * request is resolved again from its headers.
 *
 * <p>Used with {@code header-auth.session.mode=none}, e.g. when the host
 * application is stateless behind the proxy.</p>
 */
public class NoOpSessionIssuer implements SessionIssuer {

    @Override
    public void issue(HttpServletRequest request, HttpServletResponse response, UserRecord user, String browserId) {
        // intentionally empty
    }
}

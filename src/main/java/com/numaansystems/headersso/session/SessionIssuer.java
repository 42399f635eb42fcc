package com.numaansystems.headersso.session;

import com.numaansystems.headersso.exception.SessionIssuanceException;
import com.numaansystems.headersso.model.UserRecord;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

/**
 * Issues the artifact that keeps a header-authenticated user signed in on
 * later requests, typically a session cookie on the response.
 *
 * <p>Called after the security context of the current request holds the
 * user. Issuance is best-effort: a failure never un-authenticates the
 * current request.</p>
 *
 * @see NoOpSessionIssuer
 * @see HttpSessionSessionIssuer
 */
public interface SessionIssuer {

    /**
     * Issues the session for {@code user}.
     *
     * @param request   the current request
     * @param response  the response the artifact is attached to
     * @param user      the authenticated user
     * @param browserId browser id sent by the client, may be null
     * @throws SessionIssuanceException if the session could not be issued
     */
    void issue(HttpServletRequest request, HttpServletResponse response, UserRecord user, String browserId);
}

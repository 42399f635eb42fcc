package com.numaansystems.headersso;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Header SSO Application
 *
 * <p>Authenticates users of an application that sits behind an identity-aware
 * reverse proxy (Azure AD Application Proxy or any SSO gateway that forwards
 * the user's identity in HTTP headers).</p>
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Trusts the email / UPN headers set by the proxy</li>
 *   <li>Resolves the identity to an application user record</li>
 *   <li>Auto-provisions unknown users with a default role</li>
 *   <li>Keeps the user signed in through an HTTP session</li>
 *   <li>Leaves login, logout, MFA and webhook endpoints untouched</li>
 * </ul>
 *
 * <h2>Security</h2>
 * <p>No signature is checked on the headers. The application must only be
 * reachable through the proxy.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@SpringBootApplication
public class HeaderSsoApplication {

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(HeaderSsoApplication.class, args);
    }
}

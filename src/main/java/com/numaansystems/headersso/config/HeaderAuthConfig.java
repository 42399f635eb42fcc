package com.numaansystems.headersso.config;

import com.numaansystems.headersso.filter.SkipPathClassifier;
import com.numaansystems.headersso.filter.TrustedHeaderAuthenticationFilter;
import com.numaansystems.headersso.filter.TrustedHeaderExtractor;
import com.numaansystems.headersso.service.IdentityResolver;
import com.numaansystems.headersso.service.UserProvisioningService;
import com.numaansystems.headersso.session.HttpSessionSessionIssuer;
import com.numaansystems.headersso.session.NoOpSessionIssuer;
import com.numaansystems.headersso.session.SessionEstablisher;
import com.numaansystems.headersso.session.SessionIssuer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.web.context.HttpSessionSecurityContextRepository;
import org.springframework.security.web.context.SecurityContextRepository;

/**
 * Wires the header authentication components from {@link HeaderAuthProperties}.
 *
 * <p>The filter is a bean so it can be injected into the security chain, but
 * its automatic servlet container registration is disabled: it must run
 * inside the Spring Security chain only, and exactly once.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableConfigurationProperties(HeaderAuthProperties.class)
public class HeaderAuthConfig {

    @Bean
    public SkipPathClassifier skipPathClassifier(HeaderAuthProperties properties) {
        return SkipPathClassifier.from(properties.skip());
    }

    @Bean
    public TrustedHeaderExtractor trustedHeaderExtractor(HeaderAuthProperties properties) {
        return new TrustedHeaderExtractor(properties.headers());
    }

    /**
     * Shared by the security chain (load) and the session issuer (save).
     */
    @Bean
    public SecurityContextRepository securityContextRepository() {
        return new HttpSessionSecurityContextRepository();
    }

    @Bean
    public SessionIssuer sessionIssuer(HeaderAuthProperties properties,
                                       SecurityContextRepository securityContextRepository) {
        return switch (properties.session().mode()) {
            case NONE -> new NoOpSessionIssuer();
            case HTTP_SESSION -> new HttpSessionSessionIssuer(securityContextRepository);
        };
    }

    @Bean
    public SessionEstablisher sessionEstablisher(SessionIssuer sessionIssuer, HeaderAuthProperties properties) {
        return new SessionEstablisher(sessionIssuer, properties.headers().browserId());
    }

    @Bean
    public TrustedHeaderAuthenticationFilter trustedHeaderAuthenticationFilter(
            HeaderAuthProperties properties,
            SkipPathClassifier skipPathClassifier,
            TrustedHeaderExtractor trustedHeaderExtractor,
            IdentityResolver identityResolver,
            UserProvisioningService userProvisioningService,
            SessionEstablisher sessionEstablisher) {
        return new TrustedHeaderAuthenticationFilter(properties, skipPathClassifier, trustedHeaderExtractor,
                identityResolver, userProvisioningService, sessionEstablisher);
    }

    @Bean
    public FilterRegistrationBean<TrustedHeaderAuthenticationFilter> trustedHeaderFilterRegistration(
            TrustedHeaderAuthenticationFilter filter) {
        FilterRegistrationBean<TrustedHeaderAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}

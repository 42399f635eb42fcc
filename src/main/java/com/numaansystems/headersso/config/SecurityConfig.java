package com.numaansystems.headersso.config;

import com.numaansystems.headersso.filter.TrustedHeaderAuthenticationFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.context.SecurityContextHolderFilter;
import org.springframework.security.web.context.SecurityContextRepository;

/**
 * Security configuration for the application behind the identity-aware proxy.
 *
 * <p>The {@link TrustedHeaderAuthenticationFilter} is placed directly after
 * {@link SecurityContextHolderFilter}: the session-restored context is
 * already visible to it, and it runs before every other authentication
 * filter and all handlers. Routes are unchanged; only {@code /api/**}
 * requires an authenticated user, answered with 401 otherwise.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private final TrustedHeaderAuthenticationFilter trustedHeaderAuthenticationFilter;
    private final SecurityContextRepository securityContextRepository;

    public SecurityConfig(TrustedHeaderAuthenticationFilter trustedHeaderAuthenticationFilter,
                          SecurityContextRepository securityContextRepository) {
        this.trustedHeaderAuthenticationFilter = trustedHeaderAuthenticationFilter;
        this.securityContextRepository = securityContextRepository;
    }

    /**
     * Configures the security filter chain.
     *
     * @param http the HttpSecurity to configure
     * @return the configured SecurityFilterChain
     * @throws Exception if an error occurs during configuration
     */
    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .securityContext(context -> context.securityContextRepository(securityContextRepository))

            // Header authentication runs first
            .addFilterAfter(trustedHeaderAuthenticationFilter, SecurityContextHolderFilter.class)

            .authorizeHttpRequests(authorize -> authorize
                .requestMatchers("/api/**").authenticated()
                .anyRequest().permitAll()
            )

            .exceptionHandling(exceptions -> exceptions
                .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED))
            )

            // The proxy handles login; no local login forms
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .csrf(csrf -> csrf.disable());

        return http.build();
    }
}

package com.cardiorecords.config;

import com.cardiorecords.infrastructure.security.BearerTokenAuthenticationFilter;
import com.cardiorecords.infrastructure.security.JsonAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Spring Security configuration for the PHI access core.
 *
 * Security architecture:
 * - Stateless authentication via signed bearer tokens
 * - CSRF protection disabled (stateless API)
 * - Role checks at the audited entry points, so denials are audited
 *
 * Defense-in-depth layers:
 * 1. Bearer token verification and principal re-check (authentication)
 * 2. Role-based authorization inside the audit interceptor
 * 3. Owner-scoped record queries (data access control)
 * 4. AES-256-GCM payload encryption with integrity hash (data protection)
 * 5. Audit trail of every protected call (accountability)
 */
@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfiguration {

    private final BearerTokenAuthenticationFilter bearerTokenFilter;
    private final JsonAuthenticationEntryPoint authenticationEntryPoint;

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            .csrf(csrf -> csrf.disable())

            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .authorizeHttpRequests(auth -> auth
                // Public endpoints
                .requestMatchers("/actuator/health", "/actuator/info", "/error").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/auth/register", "/api/auth/login").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()

                // API endpoints require authentication; roles are checked per operation
                .requestMatchers("/api/**").authenticated()

                // All other requests denied by default
                .anyRequest().denyAll()
            )

            .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint))

            .addFilterBefore(bearerTokenFilter, UsernamePasswordAuthenticationFilter.class)

            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none'")
                )
                .frameOptions(frame -> frame.deny())
                .httpStrictTransportSecurity(hsts -> hsts
                    .includeSubDomains(true)
                    .maxAgeInSeconds(31536000) // 1 year
                )
            );

        return http.build();
    }

    /**
     * The bearer filter runs inside the security chain only.
     */
    @Bean
    public FilterRegistrationBean<BearerTokenAuthenticationFilter> bearerTokenFilterRegistration() {
        FilterRegistrationBean<BearerTokenAuthenticationFilter> registration =
            new FilterRegistrationBean<>(bearerTokenFilter);
        registration.setEnabled(false);
        return registration;
    }
}

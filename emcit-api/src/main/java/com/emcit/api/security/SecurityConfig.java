package com.emcit.api.security;

import jakarta.servlet.http.HttpServletResponse;
import org.springframework.boot.actuate.autoconfigure.security.servlet.EndpointRequest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Security configuration for the EMCIT API.
 *
 * Chains, in order:
 * - actuator: health, info and prometheus are open to probes and scrapers, the rest is denied
 * - public: login, captcha, health
 * - secured: JWT only, no sessions
 *
 * Vault endpoints only require authentication here; the role check happens in the vault so
 *   refused reveals still answer with the uniform {"error": ...} body
 */
@Configuration
public class SecurityConfig {

    private static final byte[] REFUSAL_BODY = "{\"error\":\"Unauthorized\"}".getBytes(StandardCharsets.UTF_8);

    @Bean
    @Order(1)
    SecurityFilterChain actuatorChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(EndpointRequest.toAnyEndpoint())
            .csrf(csrf -> csrf.disable())
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(EndpointRequest.to("health", "info", "prometheus")).permitAll()
                .anyRequest().denyAll()
            )
            .build();
    }

    /**
     * Public endpoints (NO JWT, NO resource server):
     * - Auth: login
     * - Captcha challenge
     * - Health & error
     */
    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher(
                "/api/v1/health",
                "/error",
                "/api/captcha",
                "/api/v1/auth/login"
            )
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/api/v1/health", "/error").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/captcha").permitAll()
                .requestMatchers(HttpMethod.POST, "/api/v1/auth/login").permitAll()
                .anyRequest().denyAll() // fail-closed
            )
            .build();
    }

    /**
     * Secured API (JWT required):
     * - /api/v1/admin/** needs ADMIN or SUPER_ADMIN
     * - everything else needs any authenticated user
     * Missing or bad tokens (401) and role refusals (403) answer with the same body as a refused vault reveal.
     */
    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http) throws Exception {
        return http
            .securityMatcher("/api/**")
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers("/api/v1/admin/**").hasAnyRole("ADMIN", "SUPER_ADMIN")
                .anyRequest().authenticated()
            )
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint(jsonUnauthorized())
                .accessDeniedHandler(jsonForbidden()))
            .oauth2ResourceServer(oauth -> oauth
                .authenticationEntryPoint(jsonUnauthorized())
                .jwt(jwt -> jwt.jwtAuthenticationConverter(new JwtRoleConverter()))
            )
            .build();
    }

    private static AuthenticationEntryPoint jsonUnauthorized() {
        return (request, response, failure) -> {
            response.setHeader("WWW-Authenticate", "Bearer");
            writeRefusal(response, 401);
        };
    }

    private static AccessDeniedHandler jsonForbidden() {
        return (request, response, denied) -> writeRefusal(response, 403);
    }

    private static void writeRefusal(HttpServletResponse response, int status) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getOutputStream().write(REFUSAL_BODY);
    }
}

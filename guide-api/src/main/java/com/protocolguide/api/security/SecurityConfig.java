package com.protocolguide.api.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Filter chains, evaluated in order:
 * 1. actuator ({@link ActuatorSecurityConfig})
 * 2. public: health views and the Stripe webhook, which authenticates itself by signature
 * 3. everything else under /api/** needs a bearer token; /api/v1/admin/** needs ROLE_ADMIN
 *
 * No sessions, no CSRF (no cookies are ever issued).
 */
@Configuration
public class SecurityConfig {

    static final String STRIPE_WEBHOOK = "/api/v1/billing/stripe/webhook";
    static final String[] PUBLIC_READS = {"/api/v1/health", "/api/v1/health/services"};
    static final String ADMIN = "/api/v1/admin/**";

    @Bean
    @Order(2)
    SecurityFilterChain publicApiChain(HttpSecurity http) throws Exception {
        return stateless(http)
            .securityMatcher("/api/v1/health", "/api/v1/health/services", "/error", STRIPE_WEBHOOK)
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.GET, PUBLIC_READS).permitAll()
                .requestMatchers(HttpMethod.POST, STRIPE_WEBHOOK).permitAll()
                .requestMatchers("/error").permitAll()
                .anyRequest().denyAll() // wrong method on a public path
            )
            .build();
    }

    @Bean
    @Order(3)
    SecurityFilterChain securedApiChain(HttpSecurity http) throws Exception {
        return stateless(http)
            .securityMatcher("/api/**")
            .authorizeHttpRequests(auth -> auth
                .requestMatchers(HttpMethod.OPTIONS, "/**").permitAll()
                .requestMatchers(ADMIN).hasRole("ADMIN")
                .anyRequest().authenticated()
            )
            .oauth2ResourceServer(oauth -> oauth
                .jwt(jwt -> jwt.jwtAuthenticationConverter(new JwtRoleConverter()))
            )
            .build();
    }

    private static HttpSecurity stateless(HttpSecurity http) throws Exception {
        return http
            .csrf(csrf -> csrf.disable())
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
    }
}

package com.nosota.roundup.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Caller authentication and webhook signature checks happen at the gateway.
 *
 * <p>Providers post webhooks without a session or CSRF token, so the chain is stateless with CSRF off.
 * The OpenAPI docs are only served when {@code roundup.api-docs.public} is set.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

    private static final String[] DOC_PATHS = {"/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html"};

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   @Value("${roundup.api-docs.public:false}") boolean publicDocs)
            throws Exception {
        return http
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .csrf(AbstractHttpConfigurer::disable)
                .authorizeHttpRequests(auth -> {
                    auth.requestMatchers("/api/v1/webhooks/**").permitAll();
                    auth.requestMatchers("/api/v1/roundup/**").permitAll();
                    if (publicDocs) {
                        auth.requestMatchers(DOC_PATHS).permitAll();
                    } else {
                        auth.requestMatchers(DOC_PATHS).denyAll();
                    }
                    auth.anyRequest().permitAll();
                })
                .build();
    }
}

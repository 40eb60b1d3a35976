/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/SecurityConfig.java
 * Project: Campus360 Incidencias Service
 * Description: Spring Security configuration for WebFlux (OAuth2 Resource Server with JWT).
 *              Actuator health and info are public; the API requires a valid access token.
 * Since: 2026-10-19
 */

package com.campus360.incidencias;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.reactive.EnableWebFluxSecurity;
import org.springframework.security.config.web.server.ServerHttpSecurity;
import org.springframework.security.web.server.SecurityWebFilterChain;

import com.campus360.incidencias.security.ProblemAuthenticationEntryPoint;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Central Spring Security configuration.
 *
 * <p>The service is an OAuth2 resource server: tokens are issued by the Campus360
 * identity service and validated against the configured issuer. Spring Security only
 * answers "is this a valid token"; what the caller may do with a given incidencia is
 * decided by {@link com.campus360.incidencias.policy.AccessPolicy}, so there is no
 * method security here.</p>
 *
 * <p>Missing and rejected tokens are answered by {@link ProblemAuthenticationEntryPoint}
 * so a 401 from the filter chain looks like one from the controllers.</p>
 */
@Configuration
@EnableWebFluxSecurity
public class SecurityConfig {

    @Bean
    public SecurityWebFilterChain securityWebFilterChain(ServerHttpSecurity http, ObjectMapper objectMapper) {
        ProblemAuthenticationEntryPoint entryPoint = new ProblemAuthenticationEntryPoint(objectMapper);
        return http
            .authorizeExchange(exchanges -> exchanges
                .pathMatchers("/actuator/health/**", "/actuator/info").permitAll()
                .anyExchange().authenticated()
            )
            .oauth2ResourceServer(oauth2 -> oauth2
                .jwt(Customizer.withDefaults())
                .authenticationEntryPoint(entryPoint)
            )
            .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(entryPoint))
            .httpBasic(ServerHttpSecurity.HttpBasicSpec::disable)
            .formLogin(ServerHttpSecurity.FormLoginSpec::disable)
            .logout(ServerHttpSecurity.LogoutSpec::disable)
            .csrf(ServerHttpSecurity.CsrfSpec::disable)
            .build();
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/security/ProblemAuthenticationEntryPoint.java
 * Project: Campus360 Incidencias Service
 * Description: 401 responses for missing or rejected bearer tokens, in the API's problem format.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.security;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.oauth2.core.OAuth2AuthenticationException;
import org.springframework.security.web.server.ServerAuthenticationEntryPoint;
import org.springframework.web.server.ServerWebExchange;

import com.campus360.incidencias.service.error.ErrorKind;
import com.campus360.incidencias.web.ProblemDetails;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Mono;

/**
 * Answers unauthenticated requests with the same {@code kind}-bearing
 * {@link ProblemDetail} the controllers return, plus the bearer challenge header.
 */
public class ProblemAuthenticationEntryPoint implements ServerAuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(ProblemAuthenticationEntryPoint.class);

    private final ObjectMapper objectMapper;

    public ProblemAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> commence(ServerWebExchange exchange, AuthenticationException ex) {
        log.debug("Rejecting unauthenticated request to {}: {}", exchange.getRequest().getPath(), ex.getMessage());

        boolean tokenRejected = ex instanceof OAuth2AuthenticationException;
        ProblemDetail body = ProblemDetails.of(HttpStatus.UNAUTHORIZED, ErrorKind.UNAUTHENTICATED,
            tokenRejected ? "Invalid access token" : "Missing access token");

        ServerHttpResponse response = exchange.getResponse();
        response.setStatusCode(HttpStatus.UNAUTHORIZED);
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, challenge(ex));
        response.getHeaders().setContentType(MediaType.APPLICATION_PROBLEM_JSON);
        return response.writeWith(Mono.fromCallable(
            () -> response.bufferFactory().wrap(objectMapper.writeValueAsBytes(body))));
    }

    private static String challenge(AuthenticationException ex) {
        if (ex instanceof OAuth2AuthenticationException oauth2) {
            return "Bearer error=\"%s\"".formatted(oauth2.getError().getErrorCode());
        }
        return "Bearer";
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/security/ActorResolver.java
 * Project: Campus360 Incidencias Service
 * Description: Turns a validated JWT into an explicit Actor.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.security;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.campus360.incidencias.config.IncidenciasProperties;
import com.campus360.incidencias.service.error.UnauthenticatedException;

/**
 * Extracts the {@link Actor} from the claims of an already validated token.
 *
 * <p>Tokens issued by different Campus360 modules name the subject differently
 * ({@code sub}, {@code user_id}, ...), so every configured claim name is tried in
 * order. A token without a usable subject or role is rejected with
 * {@link UnauthenticatedException}.</p>
 */
@Component
public class ActorResolver {

    private static final Logger log = LoggerFactory.getLogger(ActorResolver.class);

    private final List<String> subjectClaims;
    private final List<String> roleClaims;

    public ActorResolver(IncidenciasProperties properties) {
        this.subjectClaims = List.copyOf(properties.getSecurity().getSubjectClaims());
        this.roleClaims = List.copyOf(properties.getSecurity().getRoleClaims());
    }

    public Actor resolve(Jwt jwt) {
        if (jwt == null) {
            throw new UnauthenticatedException("Missing access token");
        }
        String subjectId = firstClaim(jwt, subjectClaims);
        if (subjectId == null) {
            log.debug("Rejecting token without subject claim, tried {}", subjectClaims);
            throw new UnauthenticatedException("Access token carries no subject identifier");
        }
        String role = firstClaim(jwt, roleClaims);
        if (role == null) {
            log.debug("Rejecting token of subject {} without role claim, tried {}", subjectId, roleClaims);
            throw new UnauthenticatedException("Access token carries no role");
        }
        return new Actor(subjectId, role);
    }

    private static String firstClaim(Jwt jwt, List<String> names) {
        for (String name : names) {
            Object value = jwt.getClaims().get(name);
            if (value != null && StringUtils.hasText(value.toString())) {
                return value.toString().trim();
            }
        }
        return null;
    }
}

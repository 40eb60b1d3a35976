/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/policy/AccessPolicy.java
 * Project: Campus360 Incidencias Service
 * Description: Pure authorization decisions for every incidencia operation.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.policy;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Component;

import com.campus360.incidencias.config.IncidenciasProperties;
import com.campus360.incidencias.domain.Incidencia;
import com.campus360.incidencias.security.Actor;

/**
 * Single place where role and ownership rules live.
 *
 * <p>Every method is a pure function of its arguments: no I/O, no ambient security
 * context. Callers translate a negative answer into the right failure
 * ({@code AccessDenied} for administrator-only operations, {@code NotFound} for
 * resources the actor may not see).</p>
 *
 * <ul>
 *   <li>Administrators see and change everything.</li>
 *   <li>Everybody else sees, comments on and attaches files to the incidencias they
 *       reported, and may only edit their title, description and category.</li>
 * </ul>
 */
@Component
public class AccessPolicy {

    private final Set<String> administratorRoles;

    public AccessPolicy(IncidenciasProperties properties) {
        this.administratorRoles = properties.getSecurity().getAdminRoles().stream()
            .map(role -> role.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toUnmodifiableSet());
    }

    public boolean isAdministrator(Actor actor) {
        return actor != null && administratorRoles.contains(actor.role().trim().toLowerCase(Locale.ROOT));
    }

    public boolean canView(Actor actor, Incidencia incidencia) {
        return isAdministrator(actor) || isReporter(actor, incidencia);
    }

    public boolean canModifyState(Actor actor) {
        return isAdministrator(actor);
    }

    public boolean canAssignResponsible(Actor actor) {
        return isAdministrator(actor);
    }

    public boolean canDelete(Actor actor) {
        return isAdministrator(actor);
    }

    public boolean canComment(Actor actor, Incidencia incidencia) {
        return isAdministrator(actor) || isReporter(actor, incidencia);
    }

    public boolean canAttach(Actor actor, Incidencia incidencia) {
        return canComment(actor, incidencia);
    }

    public boolean canViewInternalComments(Actor actor) {
        return isAdministrator(actor);
    }

    public boolean canWriteInternalComments(Actor actor) {
        return isAdministrator(actor);
    }

    /**
     * Priority and location are triage decisions; reporters cannot change them.
     */
    public boolean canEditTriageFields(Actor actor) {
        return isAdministrator(actor);
    }

    /**
     * Administrator-only filters (responsible party, arbitrary reporter) are honoured
     * only when this returns true.
     */
    public boolean canUseAdministrativeFilters(Actor actor) {
        return isAdministrator(actor);
    }

    public VisibilityFilter visibilityFilter(Actor actor) {
        return isAdministrator(actor)
            ? VisibilityFilter.unrestricted()
            : VisibilityFilter.reportedBy(actor.subjectId());
    }

    private static boolean isReporter(Actor actor, Incidencia incidencia) {
        return actor != null
            && incidencia != null
            && incidencia.getReporterId() != null
            && incidencia.getReporterId().equals(actor.subjectId());
    }
}

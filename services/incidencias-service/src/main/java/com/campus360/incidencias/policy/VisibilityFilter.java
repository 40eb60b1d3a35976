/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/policy/VisibilityFilter.java
 * Project: Campus360 Incidencias Service
 * Description: Server-side row restriction derived from the actor.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.policy;

/**
 * Row restriction the listing must honour. A non-null {@code reporterId} always wins
 * over any reporter filter supplied by the caller.
 */
public record VisibilityFilter(String reporterId) {

    private static final VisibilityFilter UNRESTRICTED = new VisibilityFilter(null);

    public static VisibilityFilter unrestricted() {
        return UNRESTRICTED;
    }

    public static VisibilityFilter reportedBy(String reporterId) {
        return new VisibilityFilter(reporterId);
    }

    public boolean isUnrestricted() {
        return reporterId == null;
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/IncidenciaState.java
 * Project: Campus360 Incidencias Service
 * Description: Fixed lifecycle of an incidencia and the edges allowed between its states.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Lifecycle state of an incidencia.
 *
 * <p>The set of states is fixed; the catalog table {@code estados} only supplies
 * identifiers, display names and ranks for these codes. Allowed edges:
 * <pre>
 *   pendiente -> asignada -> en_proceso -> resuelta -> cerrada
 *   any non-terminal state -> cancelada
 * </pre>
 * There is no reopen edge out of {@code resuelta} or {@code cerrada}.</p>
 */
public enum IncidenciaState {
    PENDIENTE("pendiente"),
    ASIGNADA("asignada"),
    EN_PROCESO("en_proceso"),
    RESUELTA("resuelta"),
    CERRADA("cerrada"),
    CANCELADA("cancelada");

    private final String code;

    IncidenciaState(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isTerminal() {
        return this == CERRADA || this == CANCELADA;
    }

    public boolean isActive() {
        return this == PENDIENTE || this == ASIGNADA || this == EN_PROCESO;
    }

    /**
     * Whether the resolution timestamp must be set while the incidencia is in this state.
     */
    public boolean isResolution() {
        return this == RESUELTA || this == CERRADA;
    }

    /**
     * A responsible party can be (re)assigned only while work has not been finished.
     */
    public boolean acceptsAssignment() {
        return isActive();
    }

    public boolean canTransitionTo(IncidenciaState target) {
        if (target == null || isTerminal()) {
            return false;
        }
        if (target == CANCELADA) {
            return true;
        }
        return switch (this) {
            case PENDIENTE -> target == ASIGNADA;
            case ASIGNADA -> target == EN_PROCESO;
            case EN_PROCESO -> target == RESUELTA;
            case RESUELTA -> target == CERRADA;
            default -> false;
        };
    }

    public static Optional<IncidenciaState> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(state -> state.code.equals(normalized))
            .findFirst();
    }
}

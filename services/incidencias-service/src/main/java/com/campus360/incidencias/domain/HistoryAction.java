/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/domain/HistoryAction.java
 * Project: Campus360 Incidencias Service
 * Description: Action labels written to the incidencia audit history.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.domain;

/**
 * Kind of mutation documented by a {@link HistoryEntry}. The label is what gets persisted.
 */
public enum HistoryAction {
    CREATED("created"),
    UPDATED("updated"),
    ASSIGNED_RESPONSIBLE("assigned_responsible"),
    STATE_CHANGED("state_changed"),
    COMMENT_ADDED("comment_added"),
    ATTACHMENT_ADDED("attachment_added"),
    DELETED("deleted");

    private final String label;

    HistoryAction(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}

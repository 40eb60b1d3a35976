/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/HistoryEntryResponse.java
 * Project: Campus360 Incidencias Service
 * Description: API representation of an audit history entry.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

import java.time.Instant;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One audit entry. Snapshots are returned as JSON objects rather than the strings they
 * are stored as.
 */
public record HistoryEntryResponse(
    Long id,
    Long incidenciaId,
    String action,
    String description,
    String actorId,
    JsonNode previousValue,
    JsonNode newValue,
    boolean internal,
    Instant changedAt
) {
}

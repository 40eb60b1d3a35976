/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/IncidenciaMapper.java
 * Project: Campus360 Incidencias Service
 * Description: Conversion between API DTOs and domain objects.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import org.springframework.stereotype.Component;

import com.campus360.incidencias.catalog.Catalog;
import com.campus360.incidencias.domain.Attachment;
import com.campus360.incidencias.domain.CategoryDefinition;
import com.campus360.incidencias.domain.Comment;
import com.campus360.incidencias.domain.HistoryEntry;
import com.campus360.incidencias.domain.Incidencia;
import com.campus360.incidencias.domain.PriorityDefinition;
import com.campus360.incidencias.domain.StateDefinition;
import com.campus360.incidencias.service.IncidenciaChanges;
import com.campus360.incidencias.service.IncidenciaPage;
import com.campus360.incidencias.service.NewAttachment;
import com.campus360.incidencias.service.NewIncidencia;
import com.campus360.incidencias.web.dto.AttachmentRequest;
import com.campus360.incidencias.web.dto.AttachmentResponse;
import com.campus360.incidencias.web.dto.CategoryResponse;
import com.campus360.incidencias.web.dto.CommentResponse;
import com.campus360.incidencias.web.dto.HistoryEntryResponse;
import com.campus360.incidencias.web.dto.IncidenciaPageResponse;
import com.campus360.incidencias.web.dto.IncidenciaRequest;
import com.campus360.incidencias.web.dto.IncidenciaResponse;
import com.campus360.incidencias.web.dto.IncidenciaUpdateRequest;
import com.campus360.incidencias.web.dto.PriorityResponse;
import com.campus360.incidencias.web.dto.StateResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Centralises conversion between domain objects and API DTOs so the shape of
 * responses stays consistent across controllers. Catalog ids never leave the service:
 * every reference is translated to its code through the current {@link Catalog}.
 */
@Component
public class IncidenciaMapper {

    private final ObjectMapper objectMapper;

    public IncidenciaMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public NewIncidencia toNewIncidencia(IncidenciaRequest request) {
        return new NewIncidencia(
            request.getTitle(),
            request.getDescription(),
            request.getPriority(),
            request.getCategory(),
            request.getLocationId()
        );
    }

    public IncidenciaChanges toChanges(IncidenciaUpdateRequest request) {
        return new IncidenciaChanges(
            request.getTitle(),
            request.getDescription(),
            request.getPriority(),
            request.getCategory(),
            request.getLocationId()
        );
    }

    public NewAttachment toNewAttachment(AttachmentRequest request) {
        return new NewAttachment(
            request.getFilename(),
            request.getMimeType(),
            request.getSizeBytes(),
            request.getStoragePath()
        );
    }

    public IncidenciaResponse toIncidenciaResponse(Incidencia incidencia, Catalog catalog) {
        return new IncidenciaResponse(
            incidencia.getId(),
            incidencia.getTitle(),
            incidencia.getDescription(),
            catalog.stateById(incidencia.getStateId()).map(StateDefinition::code).orElse(null),
            catalog.priorityById(incidencia.getPriorityId()).map(PriorityDefinition::code).orElse(null),
            catalog.categoryById(incidencia.getCategoryId()).map(CategoryDefinition::code).orElse(null),
            incidencia.getReporterId(),
            incidencia.getResponsibleId(),
            incidencia.getLocationId(),
            incidencia.getCreatedAt(),
            incidencia.getUpdatedAt(),
            incidencia.getResolvedAt()
        );
    }

    public IncidenciaPageResponse toPageResponse(IncidenciaPage page, Catalog catalog) {
        return new IncidenciaPageResponse(
            page.items().stream().map(incidencia -> toIncidenciaResponse(incidencia, catalog)).toList(),
            page.total(),
            page.limit(),
            page.offset(),
            page.hasMore()
        );
    }

    public CommentResponse toResponse(Comment comment) {
        return new CommentResponse(
            comment.getId(),
            comment.getIncidenciaId(),
            comment.getAuthorId(),
            comment.getContent(),
            comment.isInternal(),
            comment.getCreatedAt(),
            comment.getUpdatedAt()
        );
    }

    public AttachmentResponse toResponse(Attachment attachment) {
        return new AttachmentResponse(
            attachment.getId(),
            attachment.getIncidenciaId(),
            attachment.getFilename(),
            attachment.getMimeType(),
            attachment.getSizeBytes(),
            attachment.getStoragePath(),
            attachment.getUploaderId(),
            attachment.getCreatedAt()
        );
    }

    public HistoryEntryResponse toResponse(HistoryEntry entry) {
        return new HistoryEntryResponse(
            entry.id(),
            entry.incidenciaId(),
            entry.action(),
            entry.description(),
            entry.actorId(),
            readSnapshot(entry, entry.previousValue()),
            readSnapshot(entry, entry.newValue()),
            entry.internal(),
            entry.changedAt()
        );
    }

    public StateResponse toResponse(StateDefinition state) {
        return new StateResponse(state.code(), state.name(), state.description(), state.rank());
    }

    public PriorityResponse toResponse(PriorityDefinition priority) {
        return new PriorityResponse(priority.code(), priority.name(), priority.description(), priority.level(), priority.color());
    }

    public CategoryResponse toResponse(CategoryDefinition category) {
        return new CategoryResponse(category.code(), category.name(), category.description());
    }

    private JsonNode readSnapshot(HistoryEntry entry, String json) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("History entry %d holds an unreadable snapshot".formatted(entry.id()), e);
        }
    }
}

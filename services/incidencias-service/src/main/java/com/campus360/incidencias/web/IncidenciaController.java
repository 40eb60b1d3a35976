/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/IncidenciaController.java
 * Project: Campus360 Incidencias Service
 * Description: Reactive HTTP API for incidencias, comments, attachments and history.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import java.net.URI;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.campus360.incidencias.catalog.CatalogService;
import com.campus360.incidencias.security.Actor;
import com.campus360.incidencias.security.ActorResolver;
import com.campus360.incidencias.service.IncidenciaFilter;
import com.campus360.incidencias.service.IncidenciaService;
import com.campus360.incidencias.web.dto.AssignResponsibleRequest;
import com.campus360.incidencias.web.dto.AttachmentRequest;
import com.campus360.incidencias.web.dto.AttachmentResponse;
import com.campus360.incidencias.web.dto.ChangeStateRequest;
import com.campus360.incidencias.web.dto.CommentRequest;
import com.campus360.incidencias.web.dto.CommentResponse;
import com.campus360.incidencias.web.dto.HistoryEntryResponse;
import com.campus360.incidencias.web.dto.IncidenciaPageResponse;
import com.campus360.incidencias.web.dto.IncidenciaRequest;
import com.campus360.incidencias.web.dto.IncidenciaResponse;
import com.campus360.incidencias.web.dto.IncidenciaUpdateRequest;

import jakarta.validation.Valid;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * HTTP API exposed to the Campus360 frontend. The controller only translates between
 * HTTP and the service: the acting user is resolved from the bearer token and handed
 * to {@link IncidenciaService} explicitly, which makes every access decision.
 */
@RestController
@RequestMapping(path = "/api/incidencias", produces = MediaType.APPLICATION_JSON_VALUE)
public class IncidenciaController {

    private final IncidenciaService incidenciaService;
    private final CatalogService catalogService;
    private final IncidenciaMapper mapper;
    private final ActorResolver actorResolver;

    public IncidenciaController(
        IncidenciaService incidenciaService,
        CatalogService catalogService,
        IncidenciaMapper mapper,
        ActorResolver actorResolver
    ) {
        this.incidenciaService = incidenciaService;
        this.catalogService = catalogService;
        this.mapper = mapper;
        this.actorResolver = actorResolver;
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<IncidenciaResponse>> createIncidencia(
        @AuthenticationPrincipal Jwt jwt,
        @Valid @RequestBody IncidenciaRequest request
    ) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.create(actor, mapper.toNewIncidencia(request)))
            .zipWith(catalogService.snapshot(), mapper::toIncidenciaResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/incidencias/" + response.getId()))
                .body(response));
    }

    @GetMapping
    public Mono<IncidenciaPageResponse> listIncidencias(
        @AuthenticationPrincipal Jwt jwt,
        @RequestParam(name = "estado", required = false) String state,
        @RequestParam(name = "prioridad", required = false) String priority,
        @RequestParam(name = "categoria", required = false) String category,
        @RequestParam(name = "reportante", required = false) String reporterId,
        @RequestParam(name = "responsable", required = false) String responsibleId,
        @RequestParam(name = "limit", required = false) Integer limit,
        @RequestParam(name = "offset", required = false) Long offset
    ) {
        IncidenciaFilter filter = new IncidenciaFilter(state, priority, category, reporterId, responsibleId, limit, offset);
        return actor(jwt)
            .flatMap(actor -> incidenciaService.listIncidencias(actor, filter))
            .zipWith(catalogService.snapshot(), mapper::toPageResponse);
    }

    @GetMapping("/{id}")
    public Mono<IncidenciaResponse> getIncidencia(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.getIncidencia(actor, id))
            .zipWith(catalogService.snapshot(), mapper::toIncidenciaResponse);
    }

    @PatchMapping(path = "/{id}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IncidenciaResponse> updateIncidencia(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable Long id,
        @Valid @RequestBody IncidenciaUpdateRequest request
    ) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.updateIncidencia(actor, id, mapper.toChanges(request)))
            .zipWith(catalogService.snapshot(), mapper::toIncidenciaResponse);
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<Void>> deleteIncidencia(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.deleteIncidencia(actor, id))
            .then(Mono.fromSupplier(() -> ResponseEntity.noContent().<Void>build()));
    }

    @PutMapping(path = "/{id}/responsable", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IncidenciaResponse> assignResponsible(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable Long id,
        @Valid @RequestBody AssignResponsibleRequest request
    ) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.assignResponsible(actor, id, request.getResponsibleId(), request.getComment()))
            .zipWith(catalogService.snapshot(), mapper::toIncidenciaResponse);
    }

    @PutMapping(path = "/{id}/estado", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<IncidenciaResponse> changeState(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable Long id,
        @Valid @RequestBody ChangeStateRequest request
    ) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.changeState(actor, id, request.getState(), request.getComment()))
            .zipWith(catalogService.snapshot(), mapper::toIncidenciaResponse);
    }

    @PostMapping(path = "/{id}/comentarios", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<CommentResponse>> addComment(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable Long id,
        @Valid @RequestBody CommentRequest request
    ) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.addComment(actor, id, request.getContent(), request.isInternal()))
            .map(mapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/incidencias/" + id + "/comentarios/" + response.id()))
                .body(response));
    }

    @GetMapping("/{id}/comentarios")
    public Flux<CommentResponse> listComments(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable Long id,
        @RequestParam(name = "incluirInternos", defaultValue = "false") boolean includeInternal
    ) {
        return actor(jwt)
            .flatMapMany(actor -> incidenciaService.listComments(actor, id, includeInternal))
            .map(mapper::toResponse);
    }

    @GetMapping("/{id}/historial")
    public Flux<HistoryEntryResponse> getHistory(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return actor(jwt)
            .flatMapMany(actor -> incidenciaService.getHistory(actor, id))
            .map(mapper::toResponse);
    }

    @PostMapping(path = "/{id}/adjuntos", consumes = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<AttachmentResponse>> addAttachment(
        @AuthenticationPrincipal Jwt jwt,
        @PathVariable Long id,
        @Valid @RequestBody AttachmentRequest request
    ) {
        return actor(jwt)
            .flatMap(actor -> incidenciaService.addAttachment(actor, id, mapper.toNewAttachment(request)))
            .map(mapper::toResponse)
            .map(response -> ResponseEntity
                .created(URI.create("/api/incidencias/" + id + "/adjuntos/" + response.id()))
                .body(response));
    }

    @GetMapping("/{id}/adjuntos")
    public Flux<AttachmentResponse> listAttachments(@AuthenticationPrincipal Jwt jwt, @PathVariable Long id) {
        return actor(jwt)
            .flatMapMany(actor -> incidenciaService.listAttachments(actor, id))
            .map(mapper::toResponse);
    }

    private Mono<Actor> actor(Jwt jwt) {
        return Mono.fromCallable(() -> actorResolver.resolve(jwt));
    }
}

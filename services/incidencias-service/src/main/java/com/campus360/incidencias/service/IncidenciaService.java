/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/IncidenciaService.java
 * Project: Campus360 Incidencias Service
 * Description: Lifecycle of an incidencia: creation, triage, state machine, comments,
 *              attachments and audit history, each guarded by the access policy.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiPredicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import com.campus360.incidencias.catalog.Catalog;
import com.campus360.incidencias.catalog.CatalogService;
import com.campus360.incidencias.config.IncidenciasProperties;
import com.campus360.incidencias.domain.Attachment;
import com.campus360.incidencias.domain.CategoryDefinition;
import com.campus360.incidencias.domain.Comment;
import com.campus360.incidencias.domain.HistoryAction;
import com.campus360.incidencias.domain.HistoryEntry;
import com.campus360.incidencias.domain.Incidencia;
import com.campus360.incidencias.domain.IncidenciaState;
import com.campus360.incidencias.domain.PriorityDefinition;
import com.campus360.incidencias.domain.StateDefinition;
import com.campus360.incidencias.policy.AccessPolicy;
import com.campus360.incidencias.repository.AttachmentRepository;
import com.campus360.incidencias.repository.CommentRepository;
import com.campus360.incidencias.repository.IncidenciaRepository;
import com.campus360.incidencias.security.Actor;
import com.campus360.incidencias.service.error.AccessDeniedException;
import com.campus360.incidencias.service.error.ConflictException;
import com.campus360.incidencias.service.error.InvalidTransitionException;
import com.campus360.incidencias.service.error.NotFoundException;
import com.campus360.incidencias.service.error.ValidationException;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Application service owning the incidencia lifecycle.
 *
 * <p>Responsibilities:
 * <ul>
 *   <li>Consult {@link AccessPolicy} before every read and mutation</li>
 *   <li>Enforce the {@link IncidenciaState} machine</li>
 *   <li>Append exactly one {@link HistoryEntry} per accepted mutation, inside the same
 *       transaction as the mutation</li>
 * </ul>
 * The acting user is always an explicit {@link Actor} argument.</p>
 *
 * <p>Failure conventions: administrator-only operations fail with
 * {@link AccessDeniedException} before any lookup; every other operation on an
 * incidencia the actor may not see fails with {@link NotFoundException}, exactly as
 * if it did not exist. Concurrent writes to the same incidencia surface as
 * {@link ConflictException}.</p>
 */
@Service
public class IncidenciaService {

    private static final Logger log = LoggerFactory.getLogger(IncidenciaService.class);

    private final IncidenciaRepository incidenciaRepository;
    private final CommentRepository commentRepository;
    private final AttachmentRepository attachmentRepository;
    private final CatalogService catalogService;
    private final AccessPolicy accessPolicy;
    private final HistoryRecorder historyRecorder;
    private final IncidenciaQueryBuilder queryBuilder;
    private final Clock clock;
    private final String defaultPriority;
    private final boolean retainHistoryOnDelete;

    public IncidenciaService(
        IncidenciaRepository incidenciaRepository,
        CommentRepository commentRepository,
        AttachmentRepository attachmentRepository,
        CatalogService catalogService,
        AccessPolicy accessPolicy,
        HistoryRecorder historyRecorder,
        IncidenciaQueryBuilder queryBuilder,
        IncidenciasProperties properties,
        Clock clock
    ) {
        this.incidenciaRepository = incidenciaRepository;
        this.commentRepository = commentRepository;
        this.attachmentRepository = attachmentRepository;
        this.catalogService = catalogService;
        this.accessPolicy = accessPolicy;
        this.historyRecorder = historyRecorder;
        this.queryBuilder = queryBuilder;
        this.clock = clock;
        this.defaultPriority = properties.getDefaults().getPriority();
        this.retainHistoryOnDelete = properties.getHistory().isRetainOnDelete();
    }

    /**
     * Files a new incidencia. Any authenticated actor may do so and becomes its reporter.
     */
    @Transactional
    public Mono<Incidencia> create(Actor actor, NewIncidencia request) {
        if (!StringUtils.hasText(request.title())) {
            return Mono.error(ValidationException.blank("title"));
        }
        if (!StringUtils.hasText(request.description())) {
            return Mono.error(ValidationException.blank("description"));
        }
        String priorityCode = StringUtils.hasText(request.priorityCode()) ? request.priorityCode() : defaultPriority;

        return catalogService.snapshot()
            .flatMap(catalog -> {
                PriorityDefinition priority = catalog.priority(priorityCode)
                    .orElseThrow(() -> ValidationException.unknownCode("priority", priorityCode));
                Long categoryId = StringUtils.hasText(request.categoryCode())
                    ? catalog.category(request.categoryCode())
                        .map(CategoryDefinition::id)
                        .orElseThrow(() -> ValidationException.unknownCode("category", request.categoryCode()))
                    : null;

                Incidencia incidencia = Incidencia.report(
                    request.title().trim(),
                    request.description().trim(),
                    catalog.require(IncidenciaState.PENDIENTE).id(),
                    priority.id(),
                    categoryId,
                    blankToNull(request.locationId()),
                    actor.subjectId(),
                    clock.instant()
                );

                return incidenciaRepository.save(incidencia)
                    .flatMap(saved -> historyRecorder.record(
                            saved.getId(), actor, HistoryAction.CREATED, "Incidencia creada",
                            null, describe(saved, catalog), false)
                        .thenReturn(saved));
            })
            .doOnNext(saved -> log.info("Incidencia {} created by {}", saved.getId(), actor.subjectId()));
    }

    public Mono<Incidencia> getIncidencia(Actor actor, Long incidenciaId) {
        return findAccessible(actor, incidenciaId, accessPolicy::canView);
    }

    /**
     * Lists incidencias visible to the actor. Caller filters are ANDed with the
     * actor's visibility restriction, never the other way round.
     */
    public Mono<IncidenciaPage> listIncidencias(Actor actor, IncidenciaFilter filter) {
        return catalogService.snapshot()
            .map(catalog -> queryBuilder.build(actor, filter, catalog))
            .flatMap(criteria -> Mono.zip(
                    incidenciaRepository.search(criteria).collectList(),
                    incidenciaRepository.countMatching(criteria))
                .map(result -> new IncidenciaPage(result.getT1(), result.getT2(), criteria.limit(), criteria.offset())));
    }

    /**
     * Updates descriptive fields. Reporters may change title, description and
     * category of their own incidencias; priority and location are administrator-only.
     * A blank category or location clears it. A request that changes nothing records
     * no history.
     */
    @Transactional
    public Mono<Incidencia> updateIncidencia(Actor actor, Long incidenciaId, IncidenciaChanges changes) {
        if (changes.touchesTriageFields() && !accessPolicy.canEditTriageFields(actor)) {
            return Mono.error(AccessDeniedException.administratorsOnly("change priority or location"));
        }
        if (changes.title() != null && !StringUtils.hasText(changes.title())) {
            return Mono.error(ValidationException.blank("title"));
        }
        if (changes.description() != null && !StringUtils.hasText(changes.description())) {
            return Mono.error(ValidationException.blank("description"));
        }

        return catalogService.snapshot()
            .flatMap(catalog -> findAccessible(actor, incidenciaId, accessPolicy::canView)
                .flatMap(incidencia -> applyChanges(actor, incidencia, changes, catalog)));
    }

    private Mono<Incidencia> applyChanges(Actor actor, Incidencia incidencia, IncidenciaChanges changes, Catalog catalog) {
        Map<String, Object> before = new LinkedHashMap<>();
        Map<String, Object> after = new LinkedHashMap<>();

        if (changes.title() != null) {
            String title = changes.title().trim();
            if (!title.equals(incidencia.getTitle())) {
                before.put("title", incidencia.getTitle());
                after.put("title", title);
                incidencia.setTitle(title);
            }
        }
        if (changes.description() != null) {
            String description = changes.description().trim();
            if (!description.equals(incidencia.getDescription())) {
                before.put("description", incidencia.getDescription());
                after.put("description", description);
                incidencia.setDescription(description);
            }
        }
        if (changes.priorityCode() != null) {
            PriorityDefinition priority = catalog.priority(changes.priorityCode())
                .orElseThrow(() -> ValidationException.unknownCode("priority", changes.priorityCode()));
            if (!priority.id().equals(incidencia.getPriorityId())) {
                before.put("priority", priorityCode(catalog, incidencia));
                after.put("priority", priority.code());
                incidencia.setPriorityId(priority.id());
            }
        }
        if (changes.categoryCode() != null) {
            CategoryDefinition category = StringUtils.hasText(changes.categoryCode())
                ? catalog.category(changes.categoryCode())
                    .orElseThrow(() -> ValidationException.unknownCode("category", changes.categoryCode()))
                : null;
            Long categoryId = category == null ? null : category.id();
            if (!Objects.equals(categoryId, incidencia.getCategoryId())) {
                before.put("category", categoryCode(catalog, incidencia));
                after.put("category", category == null ? null : category.code());
                incidencia.setCategoryId(categoryId);
            }
        }
        if (changes.locationId() != null) {
            String locationId = blankToNull(changes.locationId());
            if (!Objects.equals(locationId, incidencia.getLocationId())) {
                before.put("locationId", incidencia.getLocationId());
                after.put("locationId", locationId);
                incidencia.setLocationId(locationId);
            }
        }

        if (after.isEmpty()) {
            return Mono.just(incidencia);
        }
        incidencia.setUpdatedAt(clock.instant());
        return save(incidencia)
            .flatMap(saved -> historyRecorder.record(
                    saved.getId(), actor, HistoryAction.UPDATED, "Campos actualizados: " + after.keySet(),
                    before, after, false)
                .thenReturn(saved))
            .doOnNext(saved -> log.info("Incidencia {} updated by {}: {}", saved.getId(), actor.subjectId(), after.keySet()));
    }

    public Mono<Incidencia> assignResponsible(Actor actor, Long incidenciaId, String responsibleId) {
        return assignResponsible(actor, incidenciaId, responsibleId, null);
    }

    /**
     * Assigns (or reassigns) the responsible party. A pending incidencia moves to
     * {@code asignada}; in later active states only the responsible party changes.
     */
    @Transactional
    public Mono<Incidencia> assignResponsible(Actor actor, Long incidenciaId, String responsibleId, String comment) {
        if (!accessPolicy.canAssignResponsible(actor)) {
            log.warn("Actor {} denied assigning responsible on incidencia {}", actor.subjectId(), incidenciaId);
            return Mono.error(AccessDeniedException.administratorsOnly("assign a responsible party"));
        }
        if (!StringUtils.hasText(responsibleId)) {
            return Mono.error(ValidationException.blank("responsibleId"));
        }
        String responsible = responsibleId.trim();

        return catalogService.snapshot()
            .flatMap(catalog -> findExisting(incidenciaId)
                .flatMap(incidencia -> {
                    IncidenciaState current = catalog.stateOf(incidencia);
                    if (!current.acceptsAssignment()) {
                        return Mono.error(new InvalidTransitionException(
                            "Cannot assign a responsible party while incidencia is '%s'".formatted(current.code())));
                    }
                    IncidenciaState next = current == IncidenciaState.PENDIENTE ? IncidenciaState.ASIGNADA : current;

                    Map<String, Object> before = snapshot("responsibleId", incidencia.getResponsibleId(), "state", current.code());
                    Map<String, Object> after = snapshot("responsibleId", responsible, "state", next.code());

                    incidencia.setResponsibleId(responsible);
                    incidencia.setStateId(catalog.require(next).id());
                    incidencia.setUpdatedAt(clock.instant());

                    String description = StringUtils.hasText(comment)
                        ? comment.trim()
                        : "Responsable asignado: " + responsible;
                    return save(incidencia)
                        .flatMap(saved -> historyRecorder.record(
                                saved.getId(), actor, HistoryAction.ASSIGNED_RESPONSIBLE, description,
                                before, after, false)
                            .thenReturn(saved));
                }))
            .doOnNext(saved -> log.info("Incidencia {} assigned to {} by {}", saved.getId(), responsible, actor.subjectId()));
    }

    public Mono<Incidencia> changeState(Actor actor, Long incidenciaId, String stateCode) {
        return changeState(actor, incidenciaId, stateCode, null);
    }

    /**
     * Moves the incidencia along one edge of the state machine. Entering
     * {@code resuelta} stamps the resolution time; entering {@code cancelada} clears it.
     */
    @Transactional
    public Mono<Incidencia> changeState(Actor actor, Long incidenciaId, String stateCode, String comment) {
        if (!accessPolicy.canModifyState(actor)) {
            log.warn("Actor {} denied changing state of incidencia {}", actor.subjectId(), incidenciaId);
            return Mono.error(AccessDeniedException.administratorsOnly("change the state of an incidencia"));
        }
        IncidenciaState target = IncidenciaState.fromCode(stateCode).orElse(null);
        if (target == null) {
            return Mono.error(ValidationException.unknownCode("state", stateCode));
        }

        return catalogService.snapshot()
            .flatMap(catalog -> findExisting(incidenciaId)
                .flatMap(incidencia -> {
                    IncidenciaState current = catalog.stateOf(incidencia);
                    if (!current.canTransitionTo(target)) {
                        log.debug("Rejected transition {} -> {} on incidencia {}", current.code(), target.code(), incidenciaId);
                        return Mono.error(InvalidTransitionException.between(current, target));
                    }
                    StateDefinition targetDefinition = catalog.require(target);
                    Instant now = clock.instant();

                    incidencia.setStateId(targetDefinition.id());
                    incidencia.setUpdatedAt(now);
                    if (target == IncidenciaState.RESUELTA) {
                        incidencia.setResolvedAt(now);
                    } else if (!target.isResolution()) {
                        incidencia.setResolvedAt(null);
                    }

                    String description = StringUtils.hasText(comment)
                        ? comment.trim()
                        : "Estado cambiado a " + targetDefinition.name();
                    return save(incidencia)
                        .flatMap(saved -> historyRecorder.record(
                                saved.getId(), actor, HistoryAction.STATE_CHANGED, description,
                                snapshot("state", current.code()), snapshot("state", target.code()), false)
                            .thenReturn(saved));
                }))
            .doOnNext(saved -> log.info("Incidencia {} moved to {} by {}", saved.getId(), target.code(), actor.subjectId()));
    }

    /**
     * Adds a comment. Internal comments can only be written by administrators.
     */
    @Transactional
    public Mono<Comment> addComment(Actor actor, Long incidenciaId, String content, boolean internal) {
        if (!StringUtils.hasText(content)) {
            return Mono.error(ValidationException.blank("content"));
        }

        return findAccessible(actor, incidenciaId, accessPolicy::canComment)
            .flatMap(incidencia -> {
                if (internal && !accessPolicy.canWriteInternalComments(actor)) {
                    return Mono.error(AccessDeniedException.administratorsOnly("write internal comments"));
                }
                Comment comment = Comment.newComment(incidencia.getId(), actor.subjectId(), content.trim(), internal, clock.instant());
                return commentRepository.save(comment)
                    .flatMap(saved -> historyRecorder.record(
                            incidencia.getId(), actor, HistoryAction.COMMENT_ADDED,
                            internal ? "Comentario interno agregado" : "Nuevo comentario agregado",
                            null, snapshot("commentId", saved.getId(), "internal", internal), internal)
                        .thenReturn(saved));
            });
    }

    /**
     * Comments of an incidencia, oldest first. Internal comments are silently left out
     * for actors who may not see them, whatever {@code includeInternal} says.
     */
    public Flux<Comment> listComments(Actor actor, Long incidenciaId, boolean includeInternal) {
        boolean showInternal = includeInternal && accessPolicy.canViewInternalComments(actor);
        return findAccessible(actor, incidenciaId, accessPolicy::canView)
            .flatMapMany(incidencia -> commentRepository.findByIncidenciaIdOrderByCreatedAtAscIdAsc(incidencia.getId()))
            .filter(comment -> showInternal || !comment.isInternal());
    }

    /**
     * Audit history, oldest first. Entries documenting internal comments follow the
     * visibility of those comments.
     */
    public Flux<HistoryEntry> getHistory(Actor actor, Long incidenciaId) {
        boolean showInternal = accessPolicy.canViewInternalComments(actor);
        return findAccessible(actor, incidenciaId, accessPolicy::canView)
            .flatMapMany(incidencia -> historyRecorder.history(incidencia.getId()))
            .filter(entry -> showInternal || !entry.internal());
    }

    /**
     * Registers metadata of a file already uploaded to external storage.
     */
    @Transactional
    public Mono<Attachment> addAttachment(Actor actor, Long incidenciaId, NewAttachment request) {
        if (!StringUtils.hasText(request.filename())) {
            return Mono.error(ValidationException.blank("filename"));
        }
        if (!StringUtils.hasText(request.storagePath())) {
            return Mono.error(ValidationException.blank("storagePath"));
        }
        if (request.sizeBytes() != null && request.sizeBytes() < 0) {
            return Mono.error(new ValidationException("sizeBytes must not be negative"));
        }

        return findAccessible(actor, incidenciaId, accessPolicy::canAttach)
            .flatMap(incidencia -> {
                Attachment attachment = new Attachment(
                    null,
                    incidencia.getId(),
                    request.filename().trim(),
                    blankToNull(request.mimeType()),
                    request.sizeBytes(),
                    request.storagePath().trim(),
                    actor.subjectId(),
                    clock.instant()
                );
                return attachmentRepository.save(attachment)
                    .flatMap(saved -> historyRecorder.record(
                            incidencia.getId(), actor, HistoryAction.ATTACHMENT_ADDED, "Adjunto agregado",
                            null, snapshot("attachmentId", saved.getId(), "filename", saved.getFilename()), false)
                        .thenReturn(saved));
            });
    }

    public Flux<Attachment> listAttachments(Actor actor, Long incidenciaId) {
        return findAccessible(actor, incidenciaId, accessPolicy::canView)
            .flatMapMany(incidencia -> attachmentRepository.findByIncidenciaIdOrderByCreatedAtAscIdAsc(incidencia.getId()));
    }

    /**
     * Hard delete, administrators only. Comments and attachments go with the
     * incidencia; history is either kept (plus a final {@code deleted} entry) or purged,
     * depending on {@code incidencias.history.retain-on-delete}.
     */
    @Transactional
    public Mono<Void> deleteIncidencia(Actor actor, Long incidenciaId) {
        if (!accessPolicy.canDelete(actor)) {
            log.warn("Actor {} denied deleting incidencia {}", actor.subjectId(), incidenciaId);
            return Mono.error(AccessDeniedException.administratorsOnly("delete incidencias"));
        }

        return catalogService.snapshot()
            .flatMap(catalog -> findExisting(incidenciaId)
                .flatMap(incidencia -> {
                    Map<String, Object> before = describe(incidencia, catalog);
                    Mono<Void> removal = commentRepository.deleteAllByIncidenciaId(incidenciaId)
                        .then(attachmentRepository.deleteAllByIncidenciaId(incidenciaId))
                        .then(incidenciaRepository.delete(incidencia))
                        .onErrorMap(OptimisticLockingFailureException.class,
                            error -> ConflictException.concurrentUpdate(incidenciaId, error));
                    Mono<?> history = retainHistoryOnDelete
                        ? historyRecorder.record(incidenciaId, actor, HistoryAction.DELETED, "Incidencia eliminada", before, null, false)
                        : historyRecorder.purge(incidenciaId);
                    return removal.then(history).then();
                }))
            .doOnSuccess(ignored -> log.info("Incidencia {} deleted by {}", incidenciaId, actor.subjectId()));
    }

    private Mono<Incidencia> findAccessible(Actor actor, Long incidenciaId, BiPredicate<Actor, Incidencia> rule) {
        return incidenciaRepository.findById(incidenciaId)
            .filter(incidencia -> {
                boolean allowed = rule.test(actor, incidencia);
                if (!allowed) {
                    log.debug("Hiding incidencia {} from {}", incidenciaId, actor.subjectId());
                }
                return allowed;
            })
            .switchIfEmpty(Mono.error(() -> NotFoundException.incidencia(incidenciaId)));
    }

    private Mono<Incidencia> findExisting(Long incidenciaId) {
        return incidenciaRepository.findById(incidenciaId)
            .switchIfEmpty(Mono.error(() -> NotFoundException.incidencia(incidenciaId)));
    }

    private Mono<Incidencia> save(Incidencia incidencia) {
        return incidenciaRepository.save(incidencia)
            .onErrorMap(OptimisticLockingFailureException.class, error -> {
                log.warn("Concurrent modification of incidencia {}", incidencia.getId());
                return ConflictException.concurrentUpdate(incidencia.getId(), error);
            });
    }

    private static Map<String, Object> describe(Incidencia incidencia, Catalog catalog) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", incidencia.getTitle());
        fields.put("state", catalog.stateById(incidencia.getStateId()).map(StateDefinition::code).orElse(null));
        fields.put("priority", priorityCode(catalog, incidencia));
        fields.put("category", categoryCode(catalog, incidencia));
        fields.put("reporterId", incidencia.getReporterId());
        fields.put("responsibleId", incidencia.getResponsibleId());
        fields.put("locationId", incidencia.getLocationId());
        return fields;
    }

    private static String priorityCode(Catalog catalog, Incidencia incidencia) {
        return catalog.priorityById(incidencia.getPriorityId()).map(PriorityDefinition::code).orElse(null);
    }

    private static String categoryCode(Catalog catalog, Incidencia incidencia) {
        return catalog.categoryById(incidencia.getCategoryId()).map(CategoryDefinition::code).orElse(null);
    }

    // Map.of rejects null values, snapshots routinely carry them.
    private static Map<String, Object> snapshot(Object... keysAndValues) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            values.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return values;
    }

    private static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

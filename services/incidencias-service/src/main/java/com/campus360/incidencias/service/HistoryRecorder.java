/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/HistoryRecorder.java
 * Project: Campus360 Incidencias Service
 * Description: Append-only writer and reader of the incidencia audit history.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

import java.time.Clock;
import java.util.Map;

import org.springframework.stereotype.Component;

import com.campus360.incidencias.domain.HistoryAction;
import com.campus360.incidencias.domain.HistoryEntry;
import com.campus360.incidencias.repository.HistoryEntryRepository;
import com.campus360.incidencias.security.Actor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Writes one immutable {@link HistoryEntry} per accepted mutation.
 *
 * <p>The recorder joins the caller's transaction: it is always subscribed inside the
 * same reactive chain as the mutation it documents, so a failed history write rolls
 * the mutation back. Snapshots are serialized to JSON; a snapshot that cannot be
 * serialized fails the whole operation.</p>
 */
@Component
public class HistoryRecorder {

    private final HistoryEntryRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public HistoryRecorder(HistoryEntryRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Mono<HistoryEntry> record(
        Long incidenciaId,
        Actor actor,
        HistoryAction action,
        String description,
        Map<String, ?> before,
        Map<String, ?> after,
        boolean internal
    ) {
        return Mono.fromCallable(() -> new HistoryEntry(
                null,
                incidenciaId,
                action.label(),
                description,
                actor.subjectId(),
                toJson(before),
                toJson(after),
                internal,
                clock.instant()
            ))
            .flatMap(repository::save);
    }

    /**
     * Entries of one incidencia, oldest first.
     */
    public Flux<HistoryEntry> history(Long incidenciaId) {
        return repository.findByIncidenciaIdOrderByChangedAtAscIdAsc(incidenciaId);
    }

    public Mono<Void> purge(Long incidenciaId) {
        return repository.deleteAllByIncidenciaId(incidenciaId).then();
    }

    private String toJson(Map<String, ?> snapshot) throws JsonProcessingException {
        return snapshot == null ? null : objectMapper.writeValueAsString(snapshot);
    }
}

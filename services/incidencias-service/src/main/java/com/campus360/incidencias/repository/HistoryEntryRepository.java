/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/HistoryEntryRepository.java
 * Project: Campus360 Incidencias Service
 * Description: Append-only access to the incidencia audit history.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.campus360.incidencias.domain.HistoryEntry;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface HistoryEntryRepository extends ReactiveCrudRepository<HistoryEntry, Long> {

    Flux<HistoryEntry> findByIncidenciaIdOrderByChangedAtAscIdAsc(Long incidenciaId);

    // Only used when history is configured not to outlive a deleted incidencia.
    @Modifying
    @Query("DELETE FROM historial_incidencias WHERE incidencia_id = :incidenciaId")
    Mono<Integer> deleteAllByIncidenciaId(Long incidenciaId);
}

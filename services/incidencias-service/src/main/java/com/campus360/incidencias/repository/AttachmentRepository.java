/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/AttachmentRepository.java
 * Project: Campus360 Incidencias Service
 * Description: Reactive persistence gateway for attachment metadata.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.campus360.incidencias.domain.Attachment;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AttachmentRepository extends ReactiveCrudRepository<Attachment, Long> {

    Flux<Attachment> findByIncidenciaIdOrderByCreatedAtAscIdAsc(Long incidenciaId);

    @Modifying
    @Query("DELETE FROM adjuntos WHERE incidencia_id = :incidenciaId")
    Mono<Integer> deleteAllByIncidenciaId(Long incidenciaId);
}

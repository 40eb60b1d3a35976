/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/CommentRepository.java
 * Project: Campus360 Incidencias Service
 * Description: Reactive persistence gateway for incidencia comments.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.campus360.incidencias.domain.Comment;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CommentRepository extends ReactiveCrudRepository<Comment, Long> {

    Flux<Comment> findByIncidenciaIdOrderByCreatedAtAscIdAsc(Long incidenciaId);

    @Modifying
    @Query("DELETE FROM comentarios WHERE incidencia_id = :incidenciaId")
    Mono<Integer> deleteAllByIncidenciaId(Long incidenciaId);
}

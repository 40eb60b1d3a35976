/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/IncidenciaSearchRepository.java
 * Project: Campus360 Incidencias Service
 * Description: Filtered, paginated listing of incidencias.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import com.campus360.incidencias.domain.Incidencia;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public interface IncidenciaSearchRepository {

    /**
     * Returns one page of incidencias matching every non-null field of the criteria,
     * newest first.
     */
    Flux<Incidencia> search(IncidenciaCriteria criteria);

    Mono<Long> countMatching(IncidenciaCriteria criteria);
}

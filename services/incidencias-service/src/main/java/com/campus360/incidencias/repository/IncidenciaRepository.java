/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/IncidenciaRepository.java
 * Project: Campus360 Incidencias Service
 * Description: Reactive persistence gateway for incidencias.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.campus360.incidencias.domain.Incidencia;

/**
 * Reactive persistence gateway for incidencias. CRUD comes from Spring Data; filtered
 * listing is contributed by {@link IncidenciaSearchRepository}.
 */
@Repository
public interface IncidenciaRepository extends ReactiveCrudRepository<Incidencia, Long>, IncidenciaSearchRepository {
}

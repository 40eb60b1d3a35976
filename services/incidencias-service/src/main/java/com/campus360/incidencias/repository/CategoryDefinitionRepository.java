/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/CategoryDefinitionRepository.java
 * Project: Campus360 Incidencias Service
 * Description: Read-only access to the category catalog.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

import com.campus360.incidencias.domain.CategoryDefinition;

import reactor.core.publisher.Flux;

@Repository
public interface CategoryDefinitionRepository extends ReactiveCrudRepository<CategoryDefinition, Long> {

    Flux<CategoryDefinition> findByActiveTrue();
}

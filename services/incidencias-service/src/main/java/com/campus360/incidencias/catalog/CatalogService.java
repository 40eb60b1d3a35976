/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/catalog/CatalogService.java
 * Project: Campus360 Incidencias Service
 * Description: Read-only catalog store with a time-bounded snapshot cache.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.catalog;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import com.campus360.incidencias.config.IncidenciasProperties;
import com.campus360.incidencias.repository.CategoryDefinitionRepository;
import com.campus360.incidencias.repository.PriorityDefinitionRepository;
import com.campus360.incidencias.repository.StateDefinitionRepository;

import reactor.core.publisher.Mono;

/**
 * Loads the three catalog tables into an immutable {@link Catalog}.
 *
 * <p>The snapshot is reused for {@code incidencias.catalog.cache-ttl}; failed or
 * empty loads are not cached so a database hiccup does not stick.</p>
 */
@Service
public class CatalogService {

    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final StateDefinitionRepository stateRepository;
    private final PriorityDefinitionRepository priorityRepository;
    private final CategoryDefinitionRepository categoryRepository;
    private final Mono<Catalog> snapshot;

    public CatalogService(
        StateDefinitionRepository stateRepository,
        PriorityDefinitionRepository priorityRepository,
        CategoryDefinitionRepository categoryRepository,
        IncidenciasProperties properties
    ) {
        this.stateRepository = stateRepository;
        this.priorityRepository = priorityRepository;
        this.categoryRepository = categoryRepository;
        Duration ttl = properties.getCatalog().getCacheTtl();
        this.snapshot = Mono.defer(this::load).cache(
            catalog -> ttl,
            error -> Duration.ZERO,
            () -> Duration.ZERO
        );
    }

    public Mono<Catalog> snapshot() {
        return snapshot;
    }

    private Mono<Catalog> load() {
        return Mono.zip(
                stateRepository.findByActiveTrue().collectList(),
                priorityRepository.findByActiveTrue().collectList(),
                categoryRepository.findByActiveTrue().collectList()
            )
            .map(tuple -> Catalog.of(tuple.getT1(), tuple.getT2(), tuple.getT3()))
            .doOnNext(catalog -> log.debug("Loaded catalog: {} states, {} priorities, {} categories",
                catalog.states().size(), catalog.priorities().size(), catalog.categories().size()));
    }
}

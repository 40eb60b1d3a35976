/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/CatalogController.java
 * Project: Campus360 Incidencias Service
 * Description: Read-only HTTP API over the state, priority and category catalogs.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.campus360.incidencias.catalog.Catalog;
import com.campus360.incidencias.catalog.CatalogService;
import com.campus360.incidencias.web.dto.CategoryResponse;
import com.campus360.incidencias.web.dto.PriorityResponse;
import com.campus360.incidencias.web.dto.StateResponse;

import reactor.core.publisher.Flux;

/**
 * Exposes the active catalog entries so clients can build forms and filters from codes.
 */
@RestController
@RequestMapping(path = "/api/catalogos", produces = MediaType.APPLICATION_JSON_VALUE)
public class CatalogController {

    private final CatalogService catalogService;
    private final IncidenciaMapper mapper;

    public CatalogController(CatalogService catalogService, IncidenciaMapper mapper) {
        this.catalogService = catalogService;
        this.mapper = mapper;
    }

    @GetMapping("/estados")
    public Flux<StateResponse> listStates() {
        return catalogService.snapshot()
            .flatMapIterable(Catalog::states)
            .map(mapper::toResponse);
    }

    @GetMapping("/prioridades")
    public Flux<PriorityResponse> listPriorities() {
        return catalogService.snapshot()
            .flatMapIterable(Catalog::priorities)
            .map(mapper::toResponse);
    }

    @GetMapping("/categorias")
    public Flux<CategoryResponse> listCategories() {
        return catalogService.snapshot()
            .flatMapIterable(Catalog::categories)
            .map(mapper::toResponse);
    }
}

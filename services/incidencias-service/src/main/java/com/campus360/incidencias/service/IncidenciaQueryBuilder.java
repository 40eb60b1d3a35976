/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/service/IncidenciaQueryBuilder.java
 * Project: Campus360 Incidencias Service
 * Description: Composes the final listing predicate from actor, caller filters and catalog.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import com.campus360.incidencias.catalog.Catalog;
import com.campus360.incidencias.config.IncidenciasProperties;
import com.campus360.incidencias.domain.CategoryDefinition;
import com.campus360.incidencias.domain.PriorityDefinition;
import com.campus360.incidencias.domain.StateDefinition;
import com.campus360.incidencias.policy.AccessPolicy;
import com.campus360.incidencias.policy.VisibilityFilter;
import com.campus360.incidencias.repository.IncidenciaCriteria;
import com.campus360.incidencias.security.Actor;
import com.campus360.incidencias.service.error.ValidationException;

/**
 * Builds the {@link IncidenciaCriteria} used for listings.
 *
 * <p>The visibility filter of {@link AccessPolicy} is applied last and cannot be
 * relaxed by caller input: for non-administrators the reporter is always the actor,
 * and administrator-only filters are dropped. Unknown catalog codes and out-of-range
 * paging fail before any query runs.</p>
 */
@Component
public class IncidenciaQueryBuilder {

    private static final Logger log = LoggerFactory.getLogger(IncidenciaQueryBuilder.class);

    private final AccessPolicy accessPolicy;
    private final int defaultLimit;
    private final int maxLimit;

    public IncidenciaQueryBuilder(AccessPolicy accessPolicy, IncidenciasProperties properties) {
        this.accessPolicy = accessPolicy;
        this.defaultLimit = properties.getListing().getDefaultLimit();
        this.maxLimit = properties.getListing().getMaxLimit();
    }

    public IncidenciaCriteria build(Actor actor, IncidenciaFilter filter, Catalog catalog) {
        IncidenciaFilter requested = filter == null ? IncidenciaFilter.none() : filter;

        Long stateId = null;
        if (StringUtils.hasText(requested.stateCode())) {
            stateId = catalog.state(requested.stateCode())
                .map(StateDefinition::id)
                .orElseThrow(() -> ValidationException.unknownCode("state", requested.stateCode()));
        }
        Long priorityId = null;
        if (StringUtils.hasText(requested.priorityCode())) {
            priorityId = catalog.priority(requested.priorityCode())
                .map(PriorityDefinition::id)
                .orElseThrow(() -> ValidationException.unknownCode("priority", requested.priorityCode()));
        }
        Long categoryId = null;
        if (StringUtils.hasText(requested.categoryCode())) {
            categoryId = catalog.category(requested.categoryCode())
                .map(CategoryDefinition::id)
                .orElseThrow(() -> ValidationException.unknownCode("category", requested.categoryCode()));
        }

        int limit = requested.limit() == null ? defaultLimit : requested.limit();
        if (limit < 1 || limit > maxLimit) {
            throw new ValidationException("limit must be between 1 and %d".formatted(maxLimit));
        }
        long offset = requested.offset() == null ? 0L : requested.offset();
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }

        String reporterId = blankToNull(requested.reporterId());
        String responsibleId = blankToNull(requested.responsibleId());
        VisibilityFilter visibility = accessPolicy.visibilityFilter(actor);
        if (!visibility.isUnrestricted()) {
            reporterId = visibility.reporterId();
        }
        if (responsibleId != null && !accessPolicy.canUseAdministrativeFilters(actor)) {
            log.debug("Ignoring responsible filter requested by non-administrator {}", actor.subjectId());
            responsibleId = null;
        }

        return new IncidenciaCriteria(reporterId, stateId, priorityId, categoryId, responsibleId, limit, offset);
    }

    private static String blankToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}

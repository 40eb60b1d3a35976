/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/repository/IncidenciaSearchRepositoryImpl.java
 * Project: Campus360 Incidencias Service
 * Description: R2dbcEntityTemplate implementation of the incidencia search fragment.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.repository;

import static org.springframework.data.relational.core.query.Criteria.where;

import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;

import com.campus360.incidencias.domain.Incidencia;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Spring Data picks this fragment up by its {@code Impl} suffix and mixes it into
 * {@link IncidenciaRepository}.
 */
public class IncidenciaSearchRepositoryImpl implements IncidenciaSearchRepository {

    private final R2dbcEntityTemplate template;

    public IncidenciaSearchRepositoryImpl(R2dbcEntityTemplate template) {
        this.template = template;
    }

    @Override
    public Flux<Incidencia> search(IncidenciaCriteria criteria) {
        Query query = Query.query(toCriteria(criteria))
            .sort(Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id")))
            .limit(criteria.limit())
            .offset(criteria.offset());
        return template.select(Incidencia.class)
            .matching(query)
            .all();
    }

    @Override
    public Mono<Long> countMatching(IncidenciaCriteria criteria) {
        return template.count(Query.query(toCriteria(criteria)), Incidencia.class);
    }

    static Criteria toCriteria(IncidenciaCriteria criteria) {
        Criteria result = Criteria.empty();
        if (criteria.reporterId() != null) {
            result = result.and(where("reporterId").is(criteria.reporterId()));
        }
        if (criteria.stateId() != null) {
            result = result.and(where("stateId").is(criteria.stateId()));
        }
        if (criteria.priorityId() != null) {
            result = result.and(where("priorityId").is(criteria.priorityId()));
        }
        if (criteria.categoryId() != null) {
            result = result.and(where("categoryId").is(criteria.categoryId()));
        }
        if (criteria.responsibleId() != null) {
            result = result.and(where("responsibleId").is(criteria.responsibleId()));
        }
        return result;
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/test/java/com/campus360/incidencias/service/IncidenciaQueryBuilderTest.java
 * Project: Campus360 Incidencias Service
 * Description: Unit tests for visibility-constrained query composition.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.campus360.incidencias.catalog.Catalog;
import com.campus360.incidencias.catalog.CatalogFixtures;
import com.campus360.incidencias.config.IncidenciasProperties;
import com.campus360.incidencias.policy.AccessPolicy;
import com.campus360.incidencias.repository.IncidenciaCriteria;
import com.campus360.incidencias.security.Actor;
import com.campus360.incidencias.service.error.ValidationException;

@DisplayName("IncidenciaQueryBuilder")
class IncidenciaQueryBuilderTest {

    private final IncidenciasProperties properties = new IncidenciasProperties();
    private final IncidenciaQueryBuilder builder = new IncidenciaQueryBuilder(new AccessPolicy(properties), properties);
    private final Catalog catalog = CatalogFixtures.catalog();

    private final Actor admin = new Actor("admin-1", "admin");
    private final Actor student = new Actor("u-1", "estudiante");

    @Nested
    @DisplayName("Visibility")
    class VisibilityTests {

        @Test
        @DisplayName("Non-administrators are always restricted to their own reports")
        void reporterIsForced() {
            IncidenciaFilter filter = new IncidenciaFilter(null, null, null, "someone-else", null, null, null);

            IncidenciaCriteria criteria = builder.build(student, filter, catalog);

            assertThat(criteria.reporterId()).isEqualTo("u-1");
        }

        @Test
        @DisplayName("Non-administrators cannot filter by responsible party")
        void responsibleFilterIgnored() {
            IncidenciaFilter filter = new IncidenciaFilter(null, null, null, null, "tech-9", null, null);

            IncidenciaCriteria criteria = builder.build(student, filter, catalog);

            assertThat(criteria.responsibleId()).isNull();
            assertThat(criteria.reporterId()).isEqualTo("u-1");
        }

        @Test
        @DisplayName("Administrators get exactly the filters they ask for")
        void administratorFilters() {
            IncidenciaFilter filter = new IncidenciaFilter("en_proceso", "alta", "tecnologia", "u-7", "tech-9", 20, 40L);

            IncidenciaCriteria criteria = builder.build(admin, filter, catalog);

            assertThat(criteria).isEqualTo(new IncidenciaCriteria(
                "u-7", CatalogFixtures.EN_PROCESO, CatalogFixtures.ALTA, CatalogFixtures.TECNOLOGIA, "tech-9", 20, 40L));
        }

        @Test
        @DisplayName("Administrators without filters are unrestricted")
        void administratorWithoutFilters() {
            IncidenciaCriteria criteria = builder.build(admin, IncidenciaFilter.none(), catalog);

            assertThat(criteria.reporterId()).isNull();
            assertThat(criteria.limit()).isEqualTo(10);
            assertThat(criteria.offset()).isZero();
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Unknown codes are rejected rather than ignored")
        void unknownCodes() {
            assertThatThrownBy(() -> builder.build(admin, new IncidenciaFilter("reabierta", null, null, null, null, null, null), catalog))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("reabierta");
            assertThatThrownBy(() -> builder.build(admin, new IncidenciaFilter(null, "critica", null, null, null, null, null), catalog))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> builder.build(student, new IncidenciaFilter(null, null, "jardineria", null, null, null, null), catalog))
                .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("Limit and offset are bounded")
        void pagingBounds() {
            assertThatThrownBy(() -> builder.build(admin, new IncidenciaFilter(null, null, null, null, null, 0, null), catalog))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> builder.build(admin, new IncidenciaFilter(null, null, null, null, null, 101, null), catalog))
                .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> builder.build(admin, new IncidenciaFilter(null, null, null, null, null, null, -1L), catalog))
                .isInstanceOf(ValidationException.class);
            assertThat(builder.build(admin, new IncidenciaFilter(null, null, null, null, null, 100, 0L), catalog).limit())
                .isEqualTo(100);
        }
    }
}

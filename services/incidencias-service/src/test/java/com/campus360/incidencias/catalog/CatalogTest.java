/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/test/java/com/campus360/incidencias/catalog/CatalogTest.java
 * Project: Campus360 Incidencias Service
 * Description: Unit tests for the immutable catalog snapshot.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.catalog;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Locale;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.campus360.incidencias.domain.CategoryDefinition;
import com.campus360.incidencias.domain.Incidencia;
import com.campus360.incidencias.domain.IncidenciaState;
import com.campus360.incidencias.domain.PriorityDefinition;
import com.campus360.incidencias.domain.StateDefinition;

@DisplayName("Catalog")
class CatalogTest {

    private final Catalog catalog = CatalogFixtures.catalog();

    @Test
    @DisplayName("Code lookups are case-insensitive")
    void lookupByCode() {
        assertThat(catalog.priority("ALTA")).map(PriorityDefinition::id).contains(CatalogFixtures.ALTA);
        assertThat(catalog.state(" Cerrada ")).map(StateDefinition::id).contains(CatalogFixtures.CERRADA);
        assertThat(catalog.category("tecnologia")).map(CategoryDefinition::id).contains(CatalogFixtures.TECNOLOGIA);
        assertThat(catalog.priority("critica")).isEmpty();
        assertThat(catalog.category(null)).isEmpty();
    }

    @Test
    @DisplayName("Code lookups do not depend on the default locale")
    void lookupIgnoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            Catalog turkish = CatalogFixtures.catalog();

            assertThat(turkish.category("INFRAESTRUCTURA")).map(CategoryDefinition::id).contains(CatalogFixtures.INFRAESTRUCTURA);
            assertThat(turkish.state("ASIGNADA")).map(StateDefinition::id).contains(CatalogFixtures.ASIGNADA);
            assertThat(turkish.stateOf(new Incidencia(1L, "t", "d", CatalogFixtures.EN_PROCESO, null, null,
                "s1", null, null, null, null, null, 0L))).isEqualTo(IncidenciaState.EN_PROCESO);
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    @DisplayName("Listings follow rank, level and name")
    void ordering() {
        Catalog shuffled = Catalog.of(
            List.of(CatalogFixtures.states().get(3), CatalogFixtures.states().get(0)),
            List.of(CatalogFixtures.priorities().get(2), CatalogFixtures.priorities().get(1)),
            List.of(CatalogFixtures.categories().get(5), CatalogFixtures.categories().get(0))
        );

        assertThat(shuffled.states()).extracting(StateDefinition::code).containsExactly("pendiente", "resuelta");
        assertThat(shuffled.priorities()).extracting(PriorityDefinition::code).containsExactly("media", "alta");
        assertThat(shuffled.categories()).extracting(CategoryDefinition::code).containsExactly("infraestructura", "otros");
    }

    @Test
    @DisplayName("A lifecycle state missing from the catalog is a deployment error")
    void missingLifecycleState() {
        Catalog partial = Catalog.of(List.of(CatalogFixtures.states().get(0)), List.of(), List.of());

        assertThat(partial.require(IncidenciaState.PENDIENTE).id()).isEqualTo(CatalogFixtures.PENDIENTE);
        assertThatThrownBy(() -> partial.require(IncidenciaState.CERRADA))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Id lookups tolerate null")
    void lookupById() {
        assertThat(catalog.categoryById(null)).isEmpty();
        assertThat(catalog.stateById(CatalogFixtures.EN_PROCESO)).map(StateDefinition::code).contains("en_proceso");
    }
}

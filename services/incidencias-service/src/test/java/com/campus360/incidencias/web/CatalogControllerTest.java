/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/test/java/com/campus360/incidencias/web/CatalogControllerTest.java
 * Project: Campus360 Incidencias Service
 * Description: Web layer tests for the catalog endpoints.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockJwt;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.campus360.incidencias.SecurityConfig;
import com.campus360.incidencias.catalog.CatalogFixtures;
import com.campus360.incidencias.catalog.CatalogService;

import reactor.core.publisher.Mono;

@WebFluxTest(controllers = CatalogController.class)
@Import({SecurityConfig.class, IncidenciaMapper.class})
@DisplayName("Catalog Controller Tests")
class CatalogControllerTest {

    @Autowired
    private WebTestClient webClient;

    @MockBean
    private CatalogService catalogService;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    @BeforeEach
    void setUp() {
        when(catalogService.snapshot()).thenReturn(Mono.just(CatalogFixtures.catalog()));
    }

    @Test
    @DisplayName("Lists states in workflow order")
    void listsStates() {
        webClient.mutateWith(mockJwt())
            .get().uri("/api/catalogos/estados")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(6)
            .jsonPath("$[0].code").isEqualTo("pendiente")
            .jsonPath("$[5].code").isEqualTo("cancelada");
    }

    @Test
    @DisplayName("Lists priorities with their level and colour")
    void listsPriorities() {
        webClient.mutateWith(mockJwt())
            .get().uri("/api/catalogos/prioridades")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$[0].code").isEqualTo("baja")
            .jsonPath("$[3].level").isEqualTo(4)
            .jsonPath("$[3].color").isEqualTo("#DC3545");
    }

    @Test
    @DisplayName("Lists categories by name")
    void listsCategories() {
        webClient.mutateWith(mockJwt())
            .get().uri("/api/catalogos/categorias")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(6)
            .jsonPath("$[0].code").isEqualTo("infraestructura");
    }

    @Test
    @DisplayName("Requires a token")
    void requiresToken() {
        webClient.get().uri("/api/catalogos/estados")
            .exchange()
            .expectStatus().isUnauthorized();
    }
}

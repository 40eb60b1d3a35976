/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/test/java/com/campus360/incidencias/web/IncidenciaControllerTest.java
 * Project: Campus360 Incidencias Service
 * Description: Web layer tests for the incidencias HTTP API with Spring Security enabled.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.mockJwt;

import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.security.test.web.reactive.server.SecurityMockServerConfigurers.JwtMutator;
import org.springframework.test.web.reactive.server.WebTestClient;

import com.campus360.incidencias.SecurityConfig;
import com.campus360.incidencias.catalog.CatalogFixtures;
import com.campus360.incidencias.catalog.CatalogService;
import com.campus360.incidencias.domain.Comment;
import com.campus360.incidencias.domain.HistoryEntry;
import com.campus360.incidencias.domain.Incidencia;
import com.campus360.incidencias.security.Actor;
import com.campus360.incidencias.security.ActorResolver;
import com.campus360.incidencias.service.IncidenciaFilter;
import com.campus360.incidencias.service.IncidenciaPage;
import com.campus360.incidencias.service.IncidenciaService;
import com.campus360.incidencias.service.NewIncidencia;
import com.campus360.incidencias.service.error.AccessDeniedException;
import com.campus360.incidencias.service.error.ConflictException;
import com.campus360.incidencias.service.error.InvalidTransitionException;
import com.campus360.incidencias.service.error.NotFoundException;
import com.campus360.incidencias.service.error.ValidationException;
import com.campus360.incidencias.web.dto.ChangeStateRequest;
import com.campus360.incidencias.web.dto.CommentRequest;
import com.campus360.incidencias.web.dto.IncidenciaRequest;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Tests for {@link IncidenciaController}.
 *
 * <p>Uses {@link WebFluxTest} to exercise the web layer in isolation with a mocked
 * service and Spring Security enabled.</p>
 */
@WebFluxTest(controllers = IncidenciaController.class)
@Import({SecurityConfig.class, IncidenciaMapper.class, ActorResolver.class})
@DisplayName("Incidencia Controller Tests")
class IncidenciaControllerTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T08:00:00Z");

    @Autowired
    private WebTestClient webClient;

    @MockBean
    private IncidenciaService incidenciaService;

    @MockBean
    private CatalogService catalogService;

    @MockBean
    private ReactiveJwtDecoder jwtDecoder;

    @BeforeEach
    void setUp() {
        when(catalogService.snapshot()).thenReturn(Mono.just(CatalogFixtures.catalog()));
    }

    private static JwtMutator student() {
        return mockJwt().jwt(jwt -> jwt.subject("s1").claim("role", "estudiante"));
    }

    private static JwtMutator administrator() {
        return mockJwt().jwt(jwt -> jwt.claim("sub", "m1").claim("tipo_usuario", "Administrador"));
    }

    private static Incidencia incidencia(Long id, long stateId) {
        return new Incidencia(id, "Broken projector", "Aula 204", stateId, CatalogFixtures.MEDIA,
            CatalogFixtures.TECNOLOGIA, "s1", null, "A-204", CREATED_AT, CREATED_AT, null, 0L);
    }

    @Nested
    @DisplayName("Endpoint POST /api/incidencias")
    class CreateTests {

        @Test
        @DisplayName("Creates the incidencia for the token's subject and returns 201")
        void createsIncidencia() {
            var actorCaptor = ArgumentCaptor.forClass(Actor.class);
            var requestCaptor = ArgumentCaptor.forClass(NewIncidencia.class);
            when(incidenciaService.create(actorCaptor.capture(), requestCaptor.capture()))
                .thenReturn(Mono.just(incidencia(1L, CatalogFixtures.PENDIENTE)));

            webClient.mutateWith(student())
                .post().uri("/api/incidencias")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IncidenciaRequest("Broken projector", "Aula 204", null, "tecnologia", "A-204"))
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals("Location", "/api/incidencias/1")
                .expectBody()
                .jsonPath("$.id").isEqualTo(1)
                .jsonPath("$.state").isEqualTo("pendiente")
                .jsonPath("$.priority").isEqualTo("media")
                .jsonPath("$.category").isEqualTo("tecnologia")
                .jsonPath("$.reporterId").isEqualTo("s1")
                .jsonPath("$.createdAt").isEqualTo("2026-03-01T08:00:00Z");

            assertThat(actorCaptor.getValue()).isEqualTo(new Actor("s1", "estudiante"));
            assertThat(requestCaptor.getValue().categoryCode()).isEqualTo("tecnologia");
        }

        @Test
        @DisplayName("Returns 400 with kind VALIDATION for a blank title")
        void blankTitle() {
            webClient.mutateWith(student())
                .post().uri("/api/incidencias")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IncidenciaRequest("", "Aula 204", null, null, null))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("VALIDATION");

            verify(incidenciaService, never()).create(any(), any());
        }

        @Test
        @DisplayName("Returns 400 for an unknown catalog code")
        void unknownCode() {
            when(incidenciaService.create(any(), any()))
                .thenReturn(Mono.error(ValidationException.unknownCode("priority", "critica")));

            webClient.mutateWith(student())
                .post().uri("/api/incidencias")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IncidenciaRequest("t", "d", "critica", null, null))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("VALIDATION")
                .jsonPath("$.detail").isEqualTo("Unknown priority code 'critica'");
        }

        @Test
        @DisplayName("Returns 401 without a token")
        void unauthenticated() {
            webClient.post().uri("/api/incidencias")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IncidenciaRequest("t", "d", null, null, null))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectHeader().valueEquals("WWW-Authenticate", "Bearer")
                .expectHeader().contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("UNAUTHENTICATED")
                .jsonPath("$.status").isEqualTo(401);

            verify(incidenciaService, never()).create(any(), any());
        }

        @Test
        @DisplayName("Returns 401 with kind UNAUTHENTICATED for a rejected token")
        void rejectedToken() {
            when(jwtDecoder.decode(anyString())).thenReturn(Mono.error(new BadJwtException("Jwt expired")));

            webClient.get().uri("/api/incidencias/1")
                .header("Authorization", "Bearer expired-token")
                .exchange()
                .expectStatus().isUnauthorized()
                .expectHeader().valueEquals("WWW-Authenticate", "Bearer error=\"invalid_token\"")
                .expectBody()
                .jsonPath("$.kind").isEqualTo("UNAUTHENTICATED")
                .jsonPath("$.detail").isEqualTo("Invalid access token");
        }

        @Test
        @DisplayName("Returns 401 with kind UNAUTHENTICATED when the token has no role")
        void tokenWithoutRole() {
            webClient.mutateWith(mockJwt().jwt(jwt -> jwt.subject("s1")))
                .post().uri("/api/incidencias")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new IncidenciaRequest("t", "d", null, null, null))
                .exchange()
                .expectStatus().isUnauthorized()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("UNAUTHENTICATED");
        }
    }

    @Nested
    @DisplayName("Endpoint GET /api/incidencias")
    class ListTests {

        @Test
        @DisplayName("Passes query parameters through and returns a page")
        void listsPage() {
            var filterCaptor = ArgumentCaptor.forClass(IncidenciaFilter.class);
            when(incidenciaService.listIncidencias(any(Actor.class), filterCaptor.capture()))
                .thenReturn(Mono.just(new IncidenciaPage(List.of(incidencia(3L, CatalogFixtures.ASIGNADA)), 5, 1, 0)));

            webClient.mutateWith(administrator())
                .get().uri("/api/incidencias?estado=asignada&responsable=tech1&limit=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items[0].id").isEqualTo(3)
                .jsonPath("$.items[0].state").isEqualTo("asignada")
                .jsonPath("$.total").isEqualTo(5)
                .jsonPath("$.hasMore").isEqualTo(true);

            IncidenciaFilter filter = filterCaptor.getValue();
            assertThat(filter.stateCode()).isEqualTo("asignada");
            assertThat(filter.responsibleId()).isEqualTo("tech1");
            assertThat(filter.limit()).isEqualTo(1);
            assertThat(filter.offset()).isNull();
        }
    }

    @Nested
    @DisplayName("Endpoint GET /api/incidencias/{id}")
    class GetTests {

        @Test
        @DisplayName("Returns the incidencia")
        void found() {
            when(incidenciaService.getIncidencia(any(Actor.class), eq(1L)))
                .thenReturn(Mono.just(incidencia(1L, CatalogFixtures.EN_PROCESO)));

            webClient.mutateWith(student())
                .get().uri("/api/incidencias/1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.title").isEqualTo("Broken projector")
                .jsonPath("$.state").isEqualTo("en_proceso");
        }

        @Test
        @DisplayName("Returns 404 with a problem body when hidden or missing")
        void notFound() {
            when(incidenciaService.getIncidencia(any(Actor.class), eq(99L)))
                .thenReturn(Mono.error(NotFoundException.incidencia(99L)));

            webClient.mutateWith(student())
                .get().uri("/api/incidencias/99")
                .exchange()
                .expectStatus().isNotFound()
                .expectHeader().contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("NOT_FOUND")
                .jsonPath("$.status").isEqualTo(404);
        }
    }

    @Nested
    @DisplayName("Unexpected and malformed requests")
    class ErrorTests {

        @Test
        @DisplayName("A non-numeric id is a 400 with kind VALIDATION")
        void malformedId() {
            webClient.mutateWith(student())
                .get().uri("/api/incidencias/abc")
                .exchange()
                .expectStatus().isBadRequest()
                .expectHeader().contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("VALIDATION");

            verify(incidenciaService, never()).getIncidencia(any(), any());
        }

        @Test
        @DisplayName("A malformed query parameter is a 400 with kind VALIDATION")
        void malformedQueryParameter() {
            webClient.mutateWith(student())
                .get().uri("/api/incidencias?limit=many")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("VALIDATION");
        }

        @Test
        @DisplayName("An unexpected failure is a 500 with kind INTERNAL and no internal details")
        void unexpectedFailure() {
            when(incidenciaService.getIncidencia(any(Actor.class), eq(1L)))
                .thenReturn(Mono.error(new IllegalStateException("Incidencia 1 references unknown state id 9")));

            webClient.mutateWith(student())
                .get().uri("/api/incidencias/1")
                .exchange()
                .expectStatus().isEqualTo(500)
                .expectHeader().contentType(MediaType.APPLICATION_PROBLEM_JSON)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("INTERNAL")
                .jsonPath("$.detail").isEqualTo("An unexpected error occurred, please try again later");
        }
    }

    @Nested
    @DisplayName("Endpoint PUT /api/incidencias/{id}/estado")
    class ChangeStateTests {

        @Test
        @DisplayName("Returns 403 when the policy denies the change")
        void denied() {
            when(incidenciaService.changeState(any(Actor.class), anyLong(), anyString(), isNull()))
                .thenReturn(Mono.error(AccessDeniedException.administratorsOnly("change the state of an incidencia")));

            webClient.mutateWith(student())
                .put().uri("/api/incidencias/1/estado")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ChangeStateRequest("cerrada", null))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.kind").isEqualTo("ACCESS_DENIED");
        }

        @Test
        @DisplayName("Returns 409 for a rejected transition")
        void invalidTransition() {
            when(incidenciaService.changeState(any(Actor.class), anyLong(), anyString(), any()))
                .thenReturn(Mono.error(new InvalidTransitionException("Transition from 'en_proceso' to 'cerrada' is not allowed")));

            webClient.mutateWith(administrator())
                .put().uri("/api/incidencias/1/estado")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ChangeStateRequest("cerrada", "cierre"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("INVALID_TRANSITION");
        }

        @Test
        @DisplayName("Returns 409 with kind CONFLICT on a concurrent update")
        void conflict() {
            when(incidenciaService.changeState(any(Actor.class), anyLong(), anyString(), any()))
                .thenReturn(Mono.error(ConflictException.concurrentUpdate(1L, new IllegalStateException("stale"))));

            webClient.mutateWith(administrator())
                .put().uri("/api/incidencias/1/estado")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ChangeStateRequest("asignada", null))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.kind").isEqualTo("CONFLICT");
        }

        @Test
        @DisplayName("Returns the updated incidencia for an administrator")
        void changed() {
            var actorCaptor = ArgumentCaptor.forClass(Actor.class);
            when(incidenciaService.changeState(actorCaptor.capture(), eq(1L), eq("en_proceso"), eq("empiezo")))
                .thenReturn(Mono.just(incidencia(1L, CatalogFixtures.EN_PROCESO)));

            webClient.mutateWith(administrator())
                .put().uri("/api/incidencias/1/estado")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new ChangeStateRequest("en_proceso", "empiezo"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("en_proceso");

            assertThat(actorCaptor.getValue()).isEqualTo(new Actor("m1", "Administrador"));
        }
    }

    @Nested
    @DisplayName("Comments and history")
    class CommentAndHistoryTests {

        @Test
        @DisplayName("POST comentarios returns 201")
        void addComment() {
            when(incidenciaService.addComment(any(Actor.class), eq(1L), eq("¿Novedades?"), eq(false)))
                .thenReturn(Mono.just(new Comment(10L, 1L, "s1", "¿Novedades?", false, CREATED_AT, null)));

            webClient.mutateWith(student())
                .post().uri("/api/incidencias/1/comentarios")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new CommentRequest("¿Novedades?", false))
                .exchange()
                .expectStatus().isCreated()
                .expectHeader().valueEquals("Location", "/api/incidencias/1/comentarios/10")
                .expectBody()
                .jsonPath("$.content").isEqualTo("¿Novedades?")
                .jsonPath("$.internal").isEqualTo(false);
        }

        @Test
        @DisplayName("GET comentarios forwards incluirInternos")
        void listComments() {
            when(incidenciaService.listComments(any(Actor.class), eq(1L), anyBoolean()))
                .thenReturn(Flux.just(new Comment(10L, 1L, "m1", "nota", true, CREATED_AT, null)));

            webClient.mutateWith(administrator())
                .get().uri("/api/incidencias/1/comentarios?incluirInternos=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].internal").isEqualTo(true);

            verify(incidenciaService).listComments(any(Actor.class), eq(1L), eq(true));
        }

        @Test
        @DisplayName("GET historial returns snapshots as JSON objects")
        void history() {
            when(incidenciaService.getHistory(any(Actor.class), eq(1L))).thenReturn(Flux.just(
                new HistoryEntry(20L, 1L, "state_changed", "Estado cambiado a Asignada", "m1",
                    "{\"state\":\"pendiente\"}", "{\"state\":\"asignada\"}", false, CREATED_AT)));

            webClient.mutateWith(student())
                .get().uri("/api/incidencias/1/historial")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].action").isEqualTo("state_changed")
                .jsonPath("$[0].previousValue.state").isEqualTo("pendiente")
                .jsonPath("$[0].newValue.state").isEqualTo("asignada");
        }
    }

    @Nested
    @DisplayName("Endpoint DELETE /api/incidencias/{id}")
    class DeleteTests {

        @Test
        @DisplayName("Returns 204 after deletion")
        void deleted() {
            when(incidenciaService.deleteIncidencia(any(Actor.class), eq(1L))).thenReturn(Mono.empty());

            webClient.mutateWith(administrator())
                .delete().uri("/api/incidencias/1")
                .exchange()
                .expectStatus().isNoContent();

            verify(incidenciaService).deleteIncidencia(new Actor("m1", "Administrador"), 1L);
        }
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/catalog/Catalog.java
 * Project: Campus360 Incidencias Service
 * Description: Immutable snapshot of the state, priority and category catalogs.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.catalog;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.campus360.incidencias.domain.CategoryDefinition;
import com.campus360.incidencias.domain.Incidencia;
import com.campus360.incidencias.domain.IncidenciaState;
import com.campus360.incidencias.domain.PriorityDefinition;
import com.campus360.incidencias.domain.StateDefinition;

/**
 * Immutable snapshot of the active catalog entries, indexed by code and by id.
 *
 * <p>Codes are the stable keys shared across Campus360; ids are internal to this
 * service's store. Lookups by code are case-insensitive.</p>
 */
public final class Catalog {

    private final List<StateDefinition> states;
    private final List<PriorityDefinition> priorities;
    private final List<CategoryDefinition> categories;

    private final Map<String, StateDefinition> statesByCode;
    private final Map<Long, StateDefinition> statesById;
    private final Map<String, PriorityDefinition> prioritiesByCode;
    private final Map<Long, PriorityDefinition> prioritiesById;
    private final Map<String, CategoryDefinition> categoriesByCode;
    private final Map<Long, CategoryDefinition> categoriesById;

    private Catalog(List<StateDefinition> states, List<PriorityDefinition> priorities, List<CategoryDefinition> categories) {
        this.states = states.stream()
            .sorted(Comparator.comparingInt(StateDefinition::rank))
            .toList();
        this.priorities = priorities.stream()
            .sorted(Comparator.comparingInt(PriorityDefinition::level))
            .toList();
        this.categories = categories.stream()
            .sorted(Comparator.comparing(CategoryDefinition::name))
            .toList();
        this.statesByCode = index(this.states, StateDefinition::code);
        this.statesById = byId(this.states, StateDefinition::id);
        this.prioritiesByCode = index(this.priorities, PriorityDefinition::code);
        this.prioritiesById = byId(this.priorities, PriorityDefinition::id);
        this.categoriesByCode = index(this.categories, CategoryDefinition::code);
        this.categoriesById = byId(this.categories, CategoryDefinition::id);
    }

    public static Catalog of(List<StateDefinition> states, List<PriorityDefinition> priorities, List<CategoryDefinition> categories) {
        return new Catalog(states, priorities, categories);
    }

    /** Active states ordered by rank. */
    public List<StateDefinition> states() {
        return states;
    }

    /** Active priorities ordered by level. */
    public List<PriorityDefinition> priorities() {
        return priorities;
    }

    /** Active categories ordered by name. */
    public List<CategoryDefinition> categories() {
        return categories;
    }

    public Optional<StateDefinition> state(String code) {
        return Optional.ofNullable(statesByCode.get(normalize(code)));
    }

    public Optional<PriorityDefinition> priority(String code) {
        return Optional.ofNullable(prioritiesByCode.get(normalize(code)));
    }

    public Optional<CategoryDefinition> category(String code) {
        return Optional.ofNullable(categoriesByCode.get(normalize(code)));
    }

    /**
     * Catalog row of a lifecycle state. Every state of the fixed state machine must be
     * seeded; a missing one is a deployment error, not a caller error.
     */
    public StateDefinition require(IncidenciaState state) {
        StateDefinition definition = statesByCode.get(state.code());
        if (definition == null) {
            throw new IllegalStateException("State '%s' missing from catalog".formatted(state.code()));
        }
        return definition;
    }

    public Optional<StateDefinition> stateById(Long id) {
        return Optional.ofNullable(id == null ? null : statesById.get(id));
    }

    public Optional<PriorityDefinition> priorityById(Long id) {
        return Optional.ofNullable(id == null ? null : prioritiesById.get(id));
    }

    public Optional<CategoryDefinition> categoryById(Long id) {
        return Optional.ofNullable(id == null ? null : categoriesById.get(id));
    }

    public IncidenciaState stateOf(Incidencia incidencia) {
        return stateById(incidencia.getStateId())
            .flatMap(definition -> IncidenciaState.fromCode(definition.code()))
            .orElseThrow(() -> new IllegalStateException(
                "Incidencia %d references unknown state id %d".formatted(incidencia.getId(), incidencia.getStateId())));
    }

    private static String normalize(String code) {
        return code == null ? null : code.trim().toLowerCase(Locale.ROOT);
    }

    private static <T> Map<String, T> index(List<T> entries, Function<T, String> code) {
        return entries.stream().collect(Collectors.toUnmodifiableMap(entry -> normalize(code.apply(entry)), Function.identity()));
    }

    private static <T> Map<Long, T> byId(List<T> entries, Function<T, Long> id) {
        return entries.stream().collect(Collectors.toUnmodifiableMap(id, Function.identity()));
    }
}

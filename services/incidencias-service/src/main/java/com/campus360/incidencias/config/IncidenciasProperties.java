/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/config/IncidenciasProperties.java
 * Project: Campus360 Incidencias Service
 * Description: Typed configuration of the incidencias service (identity claims, history, catalog, listing).
 * Since: 2026-10-19
 */

package com.campus360.incidencias.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Configuration properties of the incidencias service.
 *
 * <p>The structure mirrors the {@code incidencias} block of {@code application.yml}.
 * Validation ensures a broken setup (no subject claim, zero page size) is caught at
 * startup instead of surfacing as odd authorization results at runtime.</p>
 */
@Validated
@ConfigurationProperties(prefix = "incidencias")
public class IncidenciasProperties {

    @Valid
    @NestedConfigurationProperty
    private final SecurityProperties security = new SecurityProperties();

    @Valid
    @NestedConfigurationProperty
    private final HistoryProperties history = new HistoryProperties();

    @Valid
    @NestedConfigurationProperty
    private final CatalogProperties catalog = new CatalogProperties();

    @Valid
    @NestedConfigurationProperty
    private final ListingProperties listing = new ListingProperties();

    @Valid
    @NestedConfigurationProperty
    private final DefaultsProperties defaults = new DefaultsProperties();

    public SecurityProperties getSecurity() {
        return security;
    }

    public HistoryProperties getHistory() {
        return history;
    }

    public CatalogProperties getCatalog() {
        return catalog;
    }

    public ListingProperties getListing() {
        return listing;
    }

    public DefaultsProperties getDefaults() {
        return defaults;
    }

    public static class SecurityProperties {

        /**
         * Claim names accepted as the subject identifier, tried in order.
         */
        @NotEmpty
        private List<String> subjectClaims = new ArrayList<>(List.of("sub", "user_id", "usuario_id", "id"));

        /**
         * Claim names accepted as the role, tried in order.
         */
        @NotEmpty
        private List<String> roleClaims = new ArrayList<>(List.of("role", "tipo_usuario"));

        /**
         * Role values (case-insensitive) granting administrator rights.
         */
        @NotEmpty
        private List<String> adminRoles = new ArrayList<>(List.of("administrador", "admin"));

        public List<String> getSubjectClaims() {
            return subjectClaims;
        }

        public void setSubjectClaims(List<String> subjectClaims) {
            this.subjectClaims = subjectClaims;
        }

        public List<String> getRoleClaims() {
            return roleClaims;
        }

        public void setRoleClaims(List<String> roleClaims) {
            this.roleClaims = roleClaims;
        }

        public List<String> getAdminRoles() {
            return adminRoles;
        }

        public void setAdminRoles(List<String> adminRoles) {
            this.adminRoles = adminRoles;
        }
    }

    public static class HistoryProperties {

        /**
         * Keep history entries as an orphaned audit trail when their incidencia is deleted.
         */
        private boolean retainOnDelete = true;

        public boolean isRetainOnDelete() {
            return retainOnDelete;
        }

        public void setRetainOnDelete(boolean retainOnDelete) {
            this.retainOnDelete = retainOnDelete;
        }
    }

    public static class CatalogProperties {

        @NotNull
        private Duration cacheTtl = Duration.ofMinutes(5);

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    public static class ListingProperties {

        @Min(1)
        private int defaultLimit = 10;

        @Min(1)
        private int maxLimit = 100;

        public int getDefaultLimit() {
            return defaultLimit;
        }

        public void setDefaultLimit(int defaultLimit) {
            this.defaultLimit = defaultLimit;
        }

        public int getMaxLimit() {
            return maxLimit;
        }

        public void setMaxLimit(int maxLimit) {
            this.maxLimit = maxLimit;
        }

        @AssertTrue(message = "default-limit must not exceed max-limit")
        public boolean isDefaultLimitWithinMaxLimit() {
            return defaultLimit <= maxLimit;
        }
    }

    public static class DefaultsProperties {

        @NotBlank
        private String priority = "media";

        public String getPriority() {
            return priority;
        }

        public void setPriority(String priority) {
            this.priority = priority;
        }
    }
}

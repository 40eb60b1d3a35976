/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/CategoryResponse.java
 * Project: Campus360 Incidencias Service
 * Description: Catalog entry of a category.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

public record CategoryResponse(String code, String name, String description) {
}

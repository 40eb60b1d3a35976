/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/web/dto/StateResponse.java
 * Project: Campus360 Incidencias Service
 * Description: Catalog entry of a lifecycle state.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.web.dto;

public record StateResponse(String code, String name, String description, int rank) {
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/IncidenciasApp.java
 * Project: Campus360 Incidencias Service
 * Description: Spring Boot entrypoint for the incidencias microservice.
 * Since: 2026-10-19
 */

package com.campus360.incidencias;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

import com.campus360.incidencias.config.IncidenciasProperties;

/**
 * Spring Boot entry point for the Campus360 incidencias service.
 *
 * <p>The application exposes a reactive API where any authenticated user reports
 * incidencias and administrators triage, assign and resolve them. Users and rooms are
 * managed by other services and referenced here only by id.</p>
 */
@SpringBootApplication
@EnableConfigurationProperties(IncidenciasProperties.class)
public class IncidenciasApp {

    public static void main(String[] args) {
        SpringApplication.run(IncidenciasApp.class, args);
    }
}

/*
 * SPDX-License-Identifier: Apache-2.0
 * File: services/incidencias-service/src/main/java/com/campus360/incidencias/config/AppConfig.java
 * Project: Campus360 Incidencias Service
 * Description: Application-wide infrastructure beans.
 * Since: 2026-10-19
 */

package com.campus360.incidencias.config;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.campus360.incidencias.repository.IncidenciaRepository;

/**
 * Miscellaneous application-wide beans that don't belong in specific features.
 */
@Configuration
public class AppConfig {

    private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Counts existing incidencias at startup so operators see the database is reachable
     * before any traffic hits the service.
     */
    @Bean
    public ApplicationRunner databaseProbe(IncidenciaRepository repository) {
        return args -> repository.count()
            .subscribe(
                count -> log.info("Incidencias service started. Existing incidencia count: {}", count),
                error -> log.warn("Database probe failed: {}", error.getMessage())
            );
    }
}

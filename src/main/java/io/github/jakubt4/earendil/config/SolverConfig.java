package io.github.jakubt4.earendil.config;

import io.github.jakubt4.earendil.catalog.QuadDatabase;
import io.github.jakubt4.earendil.concurrent.ConcurrencyScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Wires the shared solver infrastructure: one worker pool and one quad database per application.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SolverProperties.class)
public class SolverConfig {

    @Bean(destroyMethod = "close")
    public ConcurrencyScheduler concurrencyScheduler(final SolverProperties properties) {
        final var limit = properties.maxThreads() > 0 ? properties.maxThreads() : ConcurrencyScheduler.defaultLimit();
        return new ConcurrencyScheduler(limit);
    }

    /**
     * Opens the quad database configured by {@code earendil.solver.quad-database-dir}.
     * With no directory configured the database is empty and every solve ends without a solution.
     *
     * @throws IllegalStateException if the configured directory does not exist
     */
    @Bean(destroyMethod = "close")
    public QuadDatabase quadDatabase(final SolverProperties properties) {
        final var dir = properties.quadDatabaseDir();
        if (dir == null || dir.isBlank()) {
            log.warn("No quad database configured (earendil.solver.quad-database-dir), solving is disabled");
            return QuadDatabase.empty();
        }
        final var path = Path.of(dir);
        if (!Files.isDirectory(path)) {
            throw new IllegalStateException("Quad database directory not found: " + path.toAbsolutePath());
        }
        return QuadDatabase.open(path);
    }
}

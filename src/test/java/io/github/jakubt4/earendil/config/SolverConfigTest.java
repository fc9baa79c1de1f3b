package io.github.jakubt4.earendil.config;

import io.github.jakubt4.earendil.concurrent.ConcurrencyScheduler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SolverConfigTest {

    private final SolverConfig config = new SolverConfig();

    @TempDir
    Path workDir;

    @Test
    void blankDirectoryGivesEmptyDatabase() {
        try (var database = config.quadDatabase(properties("", 2))) {
            assertThat(database.isEmpty()).isTrue();
        }
    }

    @Test
    void missingDirectoryFailsStartup() {
        final var properties = properties(workDir.resolve("nowhere").toString(), 2);

        assertThatThrownBy(() -> config.quadDatabase(properties))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nowhere");
    }

    @Test
    void existingEmptyDirectoryOpens() {
        try (var database = config.quadDatabase(properties(workDir.toString(), 2))) {
            assertThat(database.cellIds()).isEmpty();
            assertThat(database.failedFiles()).isEmpty();
        }
    }

    @Test
    void schedulerLimitFallsBackToProcessorCount() {
        try (var fixed = config.concurrencyScheduler(properties("", 3));
             var automatic = config.concurrencyScheduler(properties("", 0))) {
            assertThat(fixed.limit()).isEqualTo(3);
            assertThat(automatic.limit()).isEqualTo(ConcurrencyScheduler.defaultLimit());
        }
    }

    private static SolverProperties properties(final String quadDatabaseDir, final int maxThreads) {
        return new SolverProperties(maxThreads, quadDatabaseDir, Duration.ofSeconds(60), 0, 5, 16, 1, 1);
    }
}

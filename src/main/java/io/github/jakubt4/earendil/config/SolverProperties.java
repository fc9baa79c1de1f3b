package io.github.jakubt4.earendil.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Solver settings bound from {@code earendil.solver.*}.
 *
 * @param maxThreads          worker pool size, 0 for one worker per available processor
 * @param quadDatabaseDir     directory holding the {@code *.qdb} cell files, blank for none
 * @param timeout             default solve deadline
 * @param maxStars            stars used for quad formation, 0 to derive it from the detected count
 * @param minMatches          quad pairs required before a solution is attempted
 * @param runBatchSize        search runs scanned concurrently before checking for a winner
 * @param lowerDensityOffset  default number of lower density passes to include
 * @param higherDensityOffset default number of higher density passes to include
 */
@ConfigurationProperties(prefix = "earendil.solver")
public record SolverProperties(
        @DefaultValue("0") int maxThreads,
        @DefaultValue("") String quadDatabaseDir,
        @DefaultValue("60s") Duration timeout,
        @DefaultValue("0") int maxStars,
        @DefaultValue("5") int minMatches,
        @DefaultValue("16") int runBatchSize,
        @DefaultValue("1") int lowerDensityOffset,
        @DefaultValue("1") int higherDensityOffset) {
}

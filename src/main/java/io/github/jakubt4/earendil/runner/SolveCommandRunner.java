package io.github.jakubt4.earendil.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.jakubt4.earendil.catalog.QuadDatabaseBuilder;
import io.github.jakubt4.earendil.catalog.StarExtractor;
import io.github.jakubt4.earendil.config.SolverProperties;
import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.search.BlindSearchStrategy;
import io.github.jakubt4.earendil.search.DensityOffsets;
import io.github.jakubt4.earendil.search.NearbySearchStrategy;
import io.github.jakubt4.earendil.search.SearchStrategy;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import io.github.jakubt4.earendil.solver.ImageMetadata;
import io.github.jakubt4.earendil.solver.PlateSolver;
import io.github.jakubt4.earendil.solver.SearchParameters;
import io.github.jakubt4.earendil.solver.SolveResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line front end. Does nothing unless one of its commands is given:
 *
 * <pre>
 *   --extract=rows.csv[,more.csv.gz] --stars-dir=DIR [--max-magnitude=M]
 *   --build=STARS_DIR --out-dir=DIR [--passes=N] [--stars-per-sq-deg=D] [--pass-factor=F]
 *   --xyls=stars.txt --width=PX --height=PX [--ra=DEG --dec=DEG] [--field-radius=DEG]
 *          [--search-radius=DEG] [--timeout=30s] [--max-stars=N] [--out=result.json]
 *          [--lower-density-offset=N] [--higher-density-offset=N]
 * </pre>
 *
 * Without {@code --ra/--dec} the solve is a blind whole-sky search.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SolveCommandRunner implements ApplicationRunner {

    static final double DEFAULT_FIELD_RADIUS = 1.0;
    static final double DEFAULT_SEARCH_RADIUS = 10.0;

    private final PlateSolver plateSolver;
    private final StarExtractor starExtractor;
    private final QuadDatabaseBuilder databaseBuilder;
    private final ObjectMapper objectMapper;
    private final SolverProperties properties;

    @Override
    public void run(final ApplicationArguments args) throws IOException {
        if (args.containsOption("extract")) {
            extract(args);
        }
        if (args.containsOption("build")) {
            build(args);
        }
        if (args.containsOption("xyls")) {
            solve(args);
        }
    }

    private void extract(final ApplicationArguments args) {
        final var sources = args.getOptionValues("extract").stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .filter(value -> !value.isBlank())
                .map(Path::of)
                .toList();
        final var starsDir = Path.of(required(args, "stars-dir"));
        final var maxMagnitude = optionalDouble(args, "max-magnitude", Float.MAX_VALUE);
        starExtractor.extract(sources, starsDir, (float) maxMagnitude);
    }

    private void build(final ApplicationArguments args) {
        final var defaults = QuadDatabaseBuilder.BuildOptions.DEFAULT;
        final var options = new QuadDatabaseBuilder.BuildOptions(
                optionalInt(args, "passes", defaults.passCount()),
                optionalDouble(args, "stars-per-sq-deg", defaults.starsPerSqDeg()),
                optionalDouble(args, "pass-factor", defaults.passFactor()));
        final var report = databaseBuilder.build(Path.of(required(args, "build")),
                Path.of(required(args, "out-dir")), options);
        if (!report.failedCells().isEmpty()) {
            log.warn("{} star files could not be built: {}", report.failedCells().size(), report.failedCells());
        }
    }

    SolveResult solve(final ApplicationArguments args) throws IOException {
        final var stars = StarListReader.read(Path.of(required(args, "xyls")));
        final var image = new ImageMetadata(
                requiredInt(args, "width"),
                requiredInt(args, "height"));

        var parameters = SearchParameters.of(strategy(args));
        if (args.containsOption("timeout")) {
            parameters = parameters.withTimeout(DurationStyle.detectAndParse(required(args, "timeout")));
        }
        if (args.containsOption("max-stars")) {
            parameters = parameters.withMaxStars(requiredInt(args, "max-stars"));
        }

        final var result = plateSolver.solve(stars, image, parameters);
        final var json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result);
        if (args.containsOption("out")) {
            final var out = Path.of(required(args, "out"));
            Files.writeString(out, json);
            log.info("Result written to {}, status={}", out, result.status());
        } else {
            System.out.println(json);
        }
        return result;
    }

    private SearchStrategy strategy(final ApplicationArguments args) {
        final var hasRa = args.containsOption("ra");
        if (hasRa != args.containsOption("dec")) {
            throw new SolverInputException("--ra and --dec must be given together");
        }
        final var offsets = new DensityOffsets(
                optionalInt(args, "lower-density-offset", properties.lowerDensityOffset()),
                optionalInt(args, "higher-density-offset", properties.higherDensityOffset()));
        if (offsets.lower() > DensityOffsets.MAX_RECOMMENDED_OFFSET || offsets.higher() > DensityOffsets.MAX_RECOMMENDED_OFFSET) {
            log.warn("Density offsets {} exceed the recommended {}, solving may be slow",
                    offsets, DensityOffsets.MAX_RECOMMENDED_OFFSET);
        }
        if (!hasRa) {
            log.info("No approximate position given, running a blind search");
            return new BlindSearchStrategy(BlindSearchStrategy.DEFAULT_START_RADIUS, BlindSearchStrategy.DEFAULT_MIN_RADIUS,
                    BlindSearchStrategy.DecOrder.NORTH_FIRST, BlindSearchStrategy.RaOrder.EAST_FIRST, offsets);
        }
        final var center = new EquatorialCoords(requiredDouble(args, "ra"), requiredDouble(args, "dec"));
        return new NearbySearchStrategy(center,
                optionalDouble(args, "field-radius", DEFAULT_FIELD_RADIUS),
                optionalDouble(args, "search-radius", DEFAULT_SEARCH_RADIUS),
                offsets, true);
    }

    private static String required(final ApplicationArguments args, final String name) {
        final List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new SolverInputException("Missing required option --" + name);
        }
        return values.get(0);
    }

    private static double requiredDouble(final ApplicationArguments args, final String name) {
        final var value = required(args, name);
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw new SolverInputException("Option --" + name + " must be a number, was '" + value + "'");
        }
    }

    private static double optionalDouble(final ApplicationArguments args, final String name, final double fallback) {
        return args.containsOption(name) ? requiredDouble(args, name) : fallback;
    }

    private static int requiredInt(final ApplicationArguments args, final String name) {
        final var value = required(args, name);
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new SolverInputException("Option --" + name + " must be a whole number, was '" + value + "'");
        }
    }

    private static int optionalInt(final ApplicationArguments args, final String name, final int fallback) {
        return args.containsOption(name) ? requiredInt(args, name) : fallback;
    }
}

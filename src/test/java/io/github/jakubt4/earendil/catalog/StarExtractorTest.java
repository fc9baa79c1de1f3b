package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.concurrent.ConcurrencyScheduler;
import io.github.jakubt4.earendil.sky.CelestialSphereIndex;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

class StarExtractorTest {

    @TempDir
    Path dir;

    private ConcurrencyScheduler scheduler;
    private StarExtractor extractor;

    @BeforeEach
    void setUp() {
        scheduler = new ConcurrencyScheduler(2);
        extractor = new StarExtractor(new CelestialSphereIndex(), scheduler);
    }

    @AfterEach
    void tearDown() {
        scheduler.close();
    }

    @Test
    void routesStarsToCellFilesAndReportsCounts() throws Exception {
        final var csv = dir.resolve("part-1.csv");
        Files.writeString(csv, String.join("\n",
                "# exported catalog",
                "ra,dec,mag",
                "10.5,5.0,8.2",
                "10.7,5.1,12.5",
                "",
                "200.0,-30.0,3.1",
                "abc,def,ghi",
                "400.0,0.0,5.0"));
        final var gz = dir.resolve("part-2.txt.gz");
        try (var writer = new OutputStreamWriter(new GZIPOutputStream(Files.newOutputStream(gz)), StandardCharsets.UTF_8)) {
            writer.write("10.6 5.2 9.0\n");
        }
        final var out = dir.resolve("stars");

        final var report = extractor.extract(List.of(csv, gz), out, 10.0f);

        assertThat(report.rowsRead()).isEqualTo(7);
        assertThat(report.starsWritten()).isEqualTo(3);
        assertThat(report.starsFiltered()).isEqualTo(1);
        assertThat(report.rowsRejected()).isEqualTo(3);
        assertThat(report.starsPerCell()).containsExactly(entry("b08c01", 2L), entry("b11c16", 1L));
        assertThat(report.magnitudeHistogram()).containsExactly(entry(3, 1L), entry(8, 1L), entry(9, 1L));

        assertThat(StarRecord.readAll(out.resolve("b08c01.stars")))
                .extracting(StarRecord::ra)
                .containsExactlyInAnyOrder(10.5, 10.6);
        assertThat(StarRecord.readAll(out.resolve("b11c16.stars")))
                .containsExactly(new StarRecord(200.0, -30.0, 3.1f));
    }

    @Test
    void shardsAppendToSharedCellFiles() throws Exception {
        final var sources = new ArrayList<Path>();
        for (var shard = 0; shard < 8; shard++) {
            final var lines = new StringBuilder();
            for (var i = 0; i < 3000; i++) {
                lines.append(50.0 + (i % 100) * 0.01).append(' ').append(5.0 + shard * 0.1).append(' ').append(7.5).append('\n');
            }
            final var file = dir.resolve("shard-" + shard + ".txt");
            Files.writeString(file, lines);
            sources.add(file);
        }

        final var report = extractor.extract(sources, dir.resolve("stars"), 20.0f);

        assertThat(report.starsWritten()).isEqualTo(24_000);
        assertThat(StarRecord.readAll(dir.resolve("stars").resolve("b08c05.stars"))).hasSize(24_000);
    }

    @Test
    void failsAfterProcessingRemainingShardsWhenOneIsUnreadable() throws Exception {
        final var good = dir.resolve("good.txt");
        Files.writeString(good, "55.0 5.0 6.0\n");
        final var out = dir.resolve("stars");

        assertThatThrownBy(() -> extractor.extract(List.of(dir.resolve("missing.txt"), good), out, 20.0f))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("1 of 2");
        assertThat(StarRecord.readAll(out.resolve("b08c05.stars"))).hasSize(1);
    }
}

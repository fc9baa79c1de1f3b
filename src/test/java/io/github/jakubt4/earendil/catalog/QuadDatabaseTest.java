package io.github.jakubt4.earendil.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.github.jakubt4.earendil.catalog.QuadCatalogReaderTest.quad;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuadDatabaseTest {

    @TempDir
    Path dir;

    @Test
    void poolsPassesPerCellAndSkipsUnreadableFiles() throws Exception {
        QuadCatalogWriter.write(dir.resolve("b08c05.qdb"), 8, 5, List.of(
                new QuadCatalogWriter.PassData(1.0f, List.of(quad(1, 0.5f, 55f, 5f))),
                new QuadCatalogWriter.PassData(8.0f, List.of(quad(2, 0.5f, 55f, 5f)))));
        QuadCatalogWriter.write(dir.resolve("b08c05-extra.qdb"), 8, 5, List.of(
                new QuadCatalogWriter.PassData(3.0f, List.of(quad(3, 0.5f, 55f, 5f)))));
        QuadCatalogWriter.write(dir.resolve("b00c01.qdb"), 0, 1, List.of(
                new QuadCatalogWriter.PassData(2.0f, List.of(quad(4, 0.5f, 150f, 85f)))));
        Files.write(dir.resolve("b01c00.qdb"), new byte[]{1, 2, 3});
        Files.writeString(dir.resolve("README.txt"), "ignored");

        try (var database = QuadDatabase.open(dir)) {
            assertThat(database.cellIds()).containsExactlyInAnyOrder("b08c05", "b00c01");
            assertThat(database.failedFiles()).containsExactly(dir.resolve("b01c00.qdb"));
            assertThat(database.passesFor("b08c05")).extracting(CellPass::density).containsExactly(1.0f, 3.0f, 8.0f);
            assertThat(database.passesFor("b08c05").get(1).stream().toList()).containsExactly(quad(3, 0.5f, 55f, 5f));
            assertThat(database.passesFor("b17c00")).isEmpty();
            assertThat(database.isEmpty()).isFalse();
        }
    }

    @Test
    void emptyDatabaseHasNoPasses() {
        try (var database = QuadDatabase.empty()) {
            assertThat(database.isEmpty()).isTrue();
            assertThat(database.cellIds()).isEmpty();
            assertThat(database.passesFor("b08c05")).isEmpty();
        }
    }

    @Test
    void failsWhenDirectoryCannotBeListed() {
        assertThatThrownBy(() -> QuadDatabase.open(dir.resolve("missing")))
                .isInstanceOf(UncheckedIOException.class);
    }
}

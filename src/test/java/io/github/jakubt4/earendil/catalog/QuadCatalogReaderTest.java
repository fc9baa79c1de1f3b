package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.sky.EquatorialCoords;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.RandomAccessFile;
import java.nio.ByteBuffer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.assertj.core.api.Assertions.withinPercentage;

class QuadCatalogReaderTest {

    @TempDir
    Path dir;

    @Test
    void readsBackWhatWasWritten() {
        final var file = dir.resolve("b08c05.qdb");
        final var sparse = List.of(quad(100, 0.5f, 55.25f, 5.5f), quad(200, 0.25f, 56.0f, 6.0f));
        final var dense = List.of(quad(300, 0.125f, 57.5f, 7.25f));

        QuadCatalogWriter.write(file, 8, 5, List.of(
                new QuadCatalogWriter.PassData(4.0f, dense),
                new QuadCatalogWriter.PassData(1.5f, sparse)));

        try (var reader = QuadCatalogReader.open(file)) {
            final var descriptor = reader.descriptor();
            assertThat(descriptor.cellId()).isEqualTo("b08c05");
            assertThat(descriptor.bandIndex()).isEqualTo(8);
            assertThat(descriptor.cellIndex()).isEqualTo(5);
            assertThat(descriptor.passes()).extracting(PassDescriptor::density).containsExactly(1.5f, 4.0f);
            assertThat(descriptor.passes()).extracting(PassDescriptor::recordCount).containsExactly(2, 1);

            assertThat(reader.readPass(0).toList()).containsExactlyElementsOf(sparse);
            assertThat(reader.readPass(1).toList()).containsExactlyElementsOf(dense);
        }
    }

    @Test
    void streamsPassesLargerThanOneChunk() {
        final var file = dir.resolve("b09c00.qdb");
        final var quads = new ArrayList<QuadRecord>();
        for (var i = 0; i < 10_000; i++) {
            quads.add(quad(1 + i % 1000, 0.01f * (1 + i % 50), 1.0f + (i % 8), -1.0f - (i % 9)));
        }
        QuadCatalogWriter.write(file, 9, 0, List.of(new QuadCatalogWriter.PassData(20.0f, quads)));

        try (var reader = QuadCatalogReader.open(file)) {
            assertThat(reader.readPass(0).count()).isEqualTo(10_000);
            assertThat(reader.readPass(0).skip(9_999).findFirst()).contains(quads.get(9_999));
            assertThat(reader.readPass(0).limit(3).toList()).containsExactlyElementsOf(quads.subList(0, 3));
        }
    }

    @Test
    void rejectsUnsupportedVersionBeforeReadingAnythingElse() throws Exception {
        final var file = writeSample("b08c05.qdb");
        try (var raw = new RandomAccessFile(file.toFile(), "rw")) {
            raw.seek(QuadCatalogFormat.MAGIC.length);
            raw.write(2);
            raw.setLength(QuadCatalogFormat.MAGIC.length + 1);
        }

        assertThatThrownBy(() -> QuadCatalogReader.open(file))
                .isInstanceOfSatisfying(CatalogVersionException.class,
                        e -> assertThat(e.foundVersion()).isEqualTo(2));
    }

    @Test
    void rejectsForeignFiles() throws Exception {
        final var file = dir.resolve("notes.qdb");
        Files.writeString(file, "this is not a quad catalog at all");

        assertThatThrownBy(() -> QuadCatalogReader.open(file))
                .isInstanceOfSatisfying(CatalogVersionException.class,
                        e -> assertThat(e.foundVersion()).isEqualTo(-1));
    }

    @Test
    void rejectsTruncatedFiles() throws Exception {
        final var file = writeSample("b08c05.qdb");
        try (var raw = new RandomAccessFile(file.toFile(), "rw")) {
            raw.setLength(raw.length() - 5);
        }

        assertThatThrownBy(() -> QuadCatalogReader.open(file)).isInstanceOf(CatalogFormatException.class);
    }

    @Test
    void rejectsTruncatedHeader() throws Exception {
        final var file = writeSample("b08c05.qdb");
        try (var raw = new RandomAccessFile(file.toFile(), "rw")) {
            raw.setLength(QuadCatalogFormat.HEADER_LENGTH + 3);
        }

        assertThatThrownBy(() -> QuadCatalogReader.open(file)).isInstanceOf(CatalogFormatException.class);
    }

    @Test
    void reportsMissingFile() {
        assertThatThrownBy(() -> QuadCatalogReader.open(dir.resolve("missing.qdb")))
                .isExactlyInstanceOf(CatalogException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void ratioPackingKeepsRelativePrecision() {
        final var ratios = new float[]{0.02f, 0.1234f, 0.4567f, 0.8765f, 0.999f};

        final var unpacked = packAndUnpack(ratios);

        for (var i = 0; i < 3; i++) {
            assertThat((double) unpacked[i]).isCloseTo(ratios[i], withinPercentage(0.27));
        }
        for (var i = 3; i < 5; i++) {
            assertThat((double) unpacked[i]).isCloseTo(ratios[i], withinPercentage(0.53));
        }
    }

    @Test
    void unpackedRatiosStayAscendingAcrossBitWidths() {
        final var ratios = new float[]{0.32355815f, 0.40175954f, 0.6929f, 0.6929f, 0.7064579f};

        final var unpacked = packAndUnpack(ratios);

        assertThat(unpacked).isSorted();
        assertThat((double) unpacked[3]).isCloseTo(ratios[3], withinPercentage(0.53));
    }

    @Test
    void zeroRatioStaysZeroAndTinyRatiosAreClamped() {
        final var unpacked = packAndUnpack(new float[]{0.0f, 0.0001f, 0.5f, 0.5f, 1.0f});

        assertThat(unpacked[0]).isZero();
        assertThat((double) unpacked[1]).isCloseTo(QuadCatalogFormat.MIN_RATIO, offset(1e-6));
        assertThat(unpacked[4]).isEqualTo(1.0f);
    }

    private Path writeSample(final String name) {
        final var file = dir.resolve(name);
        QuadCatalogWriter.write(file, 8, 5, List.of(
                new QuadCatalogWriter.PassData(1.0f, List.of(quad(10, 0.5f, 55.0f, 5.0f), quad(20, 0.5f, 56.0f, 5.0f)))));
        return file;
    }

    /** A record whose ratios survive the packing unchanged. */
    static QuadRecord quad(final int step, final float largestDistance, final float ra, final float dec) {
        final var first = 0.1f + step / 1000f;
        final var ratios = packAndUnpack(new float[]{first, first + 0.05f, first + 0.1f, first + 0.15f, first + 0.2f});
        return new QuadRecord(ratios, largestDistance, EquatorialCoords.normalized(ra, dec));
    }

    private static float[] packAndUnpack(final float[] ratios) {
        final var buffer = ByteBuffer.allocate(QuadCatalogFormat.RATIOS_LENGTH);
        QuadCatalogFormat.packRatios(ratios, buffer);
        return QuadCatalogFormat.unpackRatios(buffer.flip());
    }
}

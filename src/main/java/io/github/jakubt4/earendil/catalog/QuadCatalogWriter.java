package io.github.jakubt4.earendil.catalog;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Writes cell files in the layout described by {@link QuadCatalogFormat}.
 */
@Slf4j
public final class QuadCatalogWriter {

    /**
     * Quads of a single pass, in any order.
     *
     * @param density quads per square degree, used to order the passes in the file
     */
    public record PassData(float density, List<QuadRecord> quads) {
    }

    private QuadCatalogWriter() {
    }

    /**
     * Writes (or replaces) the cell file at {@code path}. Passes are sorted by ascending density.
     *
     * @return the descriptor that a reader will decode from the written file
     */
    public static CellFileDescriptor write(final Path path, final int bandIndex, final int cellIndex,
                                           final List<PassData> passes) {
        if (passes.size() > QuadCatalogFormat.MAX_PASSES) {
            throw new CatalogFormatException("Too many passes for one cell file: " + passes.size());
        }
        final var sorted = new ArrayList<>(passes);
        sorted.sort(Comparator.comparingDouble(PassData::density));

        final var descriptors = new ArrayList<PassDescriptor>(sorted.size());
        var offset = QuadCatalogFormat.dataStart(sorted.size());
        for (final var pass : sorted) {
            descriptors.add(new PassDescriptor(pass.density(), pass.quads().size(), offset));
            offset += (long) pass.quads().size() * QuadCatalogFormat.RECORD_LENGTH;
        }

        try (var channel = FileChannel.open(path, StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
            final var header = ByteBuffer.allocate((int) QuadCatalogFormat.dataStart(sorted.size()));
            header.put(QuadCatalogFormat.MAGIC);
            header.put(QuadCatalogFormat.VERSION);
            header.putInt(bandIndex);
            header.putInt(cellIndex);
            header.putInt(sorted.size());
            for (final var descriptor : descriptors) {
                header.putFloat(descriptor.density());
                header.putInt(descriptor.recordCount());
                header.putLong(descriptor.dataOffset());
            }
            writeFully(channel, header.flip());

            final var buffer = ByteBuffer.allocate(1024 * QuadCatalogFormat.RECORD_LENGTH);
            for (final var pass : sorted) {
                for (final var quad : pass.quads()) {
                    if (!buffer.hasRemaining()) {
                        writeFully(channel, buffer.flip());
                        buffer.clear();
                    }
                    QuadCatalogFormat.packRatios(quad.ratios(), buffer);
                    buffer.putFloat(quad.largestDistance());
                    buffer.putFloat((float) quad.midpoint().ra());
                    buffer.putFloat((float) quad.midpoint().dec());
                }
            }
            writeFully(channel, buffer.flip());
        } catch (final IOException e) {
            throw new CatalogException("Failed to write catalog file " + path + ": " + e.getMessage(), e);
        }

        final var descriptor = new CellFileDescriptor(bandIndex, cellIndex, descriptors);
        log.debug("Wrote {} — {} passes, {} bytes", path.getFileName(), descriptors.size(), offset);
        return descriptor;
    }

    private static void writeFully(final FileChannel channel, final ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }
}

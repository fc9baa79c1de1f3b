package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.sky.EquatorialCoords;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Read-only view of one cell file.
 *
 * <p>The header is validated on {@link #open}; quad data is only touched by
 * {@link #readPass}. Reads use positional {@link FileChannel} access, so a single
 * reader can serve any number of concurrent pass streams without locking.
 */
@Slf4j
public final class QuadCatalogReader implements AutoCloseable {

    private static final int RECORDS_PER_CHUNK = 4096;

    private final Path path;
    private final FileChannel channel;
    private final CellFileDescriptor descriptor;

    private QuadCatalogReader(final Path path, final FileChannel channel, final CellFileDescriptor descriptor) {
        this.path = path;
        this.channel = channel;
        this.descriptor = descriptor;
    }

    /**
     * Opens a cell file and decodes its header.
     *
     * @throws CatalogVersionException if the magic or version byte is not recognised
     * @throws CatalogFormatException  if the file is truncated or the pass table is inconsistent
     * @throws CatalogException        if the file cannot be read at all
     */
    public static QuadCatalogReader open(final Path path) {
        final FileChannel channel;
        try {
            channel = FileChannel.open(path, StandardOpenOption.READ);
        } catch (final NoSuchFileException e) {
            throw new CatalogException("Catalog file not found: " + path, e);
        } catch (final IOException e) {
            throw new CatalogException("Cannot open catalog file " + path + ": " + e.getMessage(), e);
        }
        try {
            final var descriptor = readDescriptor(path, channel);
            log.debug("Opened {} — cell {}, {} passes", path.getFileName(), descriptor.cellId(), descriptor.passCount());
            return new QuadCatalogReader(path, channel, descriptor);
        } catch (final RuntimeException e) {
            closeQuietly(channel, e);
            throw e;
        }
    }

    public CellFileDescriptor descriptor() {
        return descriptor;
    }

    public Path path() {
        return path;
    }

    /**
     * Streams the records of one pass lazily, a chunk at a time.
     *
     * @throws IndexOutOfBoundsException if the pass index is not in the descriptor
     * @throws CatalogException          from the stream's terminal operation if the read fails
     */
    public Stream<QuadRecord> readPass(final int passIndex) {
        final var pass = descriptor.passes().get(passIndex);
        return StreamSupport.stream(new PassSpliterator(pass), false);
    }

    @Override
    public void close() {
        try {
            channel.close();
        } catch (final IOException e) {
            throw new CatalogException("Failed to close " + path, e);
        }
    }

    private static CellFileDescriptor readDescriptor(final Path path, final FileChannel channel) {
        try {
            final var size = channel.size();
            final var magicAndVersion = readFully(channel, 0, QuadCatalogFormat.MAGIC.length + 1, path);

            final var magic = new byte[QuadCatalogFormat.MAGIC.length];
            magicAndVersion.get(magic);
            if (!Arrays.equals(magic, QuadCatalogFormat.MAGIC)) {
                throw new CatalogVersionException("Unrecognized catalog header in " + path, -1);
            }
            final var version = magicAndVersion.get() & 0xFF;
            if (version != QuadCatalogFormat.VERSION) {
                throw new CatalogVersionException(
                        "Unsupported catalog version " + version + " in " + path
                                + ", expected " + QuadCatalogFormat.VERSION, version);
            }

            final var header = readFully(channel, magicAndVersion.capacity(), 3 * Integer.BYTES, path);
            final var bandIndex = header.getInt();
            final var cellIndex = header.getInt();
            final var passCount = header.getInt();
            if (passCount < 0 || passCount > QuadCatalogFormat.MAX_PASSES) {
                throw new CatalogFormatException("Invalid pass count " + passCount + " in " + path);
            }

            final var table = readFully(channel, QuadCatalogFormat.HEADER_LENGTH,
                    passCount * QuadCatalogFormat.PASS_ENTRY_LENGTH, path);
            final var passes = new ArrayList<PassDescriptor>(passCount);
            var previousDensity = Float.NEGATIVE_INFINITY;
            for (var i = 0; i < passCount; i++) {
                final var pass = new PassDescriptor(table.getFloat(), table.getInt(), table.getLong());
                if (pass.recordCount() < 0
                        || pass.dataOffset() < QuadCatalogFormat.dataStart(passCount)
                        || pass.dataOffset() + pass.byteLength() > size) {
                    throw new CatalogFormatException("Pass " + i + " of " + path + " points outside the file"
                            + " (offset=" + pass.dataOffset() + ", records=" + pass.recordCount() + ", size=" + size + ")");
                }
                if (pass.density() < previousDensity) {
                    throw new CatalogFormatException("Passes of " + path + " are not in ascending density order");
                }
                previousDensity = pass.density();
                passes.add(pass);
            }
            return new CellFileDescriptor(bandIndex, cellIndex, passes);
        } catch (final IOException e) {
            throw new CatalogException("Failed to read header of " + path + ": " + e.getMessage(), e);
        }
    }

    private static ByteBuffer readFully(final FileChannel channel, final long position, final int length,
                                        final Path path) throws IOException {
        final var buffer = ByteBuffer.allocate(length);
        while (buffer.hasRemaining()) {
            final var read = channel.read(buffer, position + buffer.position());
            if (read < 0) {
                throw new CatalogFormatException("Truncated catalog file " + path
                        + ": expected " + length + " bytes at offset " + position);
            }
        }
        return buffer.flip();
    }

    private static void closeQuietly(final FileChannel channel, final RuntimeException primary) {
        try {
            channel.close();
        } catch (final IOException e) {
            primary.addSuppressed(e);
        }
    }

    private final class PassSpliterator extends Spliterators.AbstractSpliterator<QuadRecord> {

        private final long end;
        private long position;
        private ByteBuffer chunk = ByteBuffer.allocate(0);

        PassSpliterator(final PassDescriptor pass) {
            super(pass.recordCount(), Spliterator.ORDERED | Spliterator.NONNULL | Spliterator.SIZED);
            this.position = pass.dataOffset();
            this.end = pass.dataOffset() + pass.byteLength();
        }

        @Override
        public boolean tryAdvance(final Consumer<? super QuadRecord> action) {
            if (!chunk.hasRemaining()) {
                if (position >= end) {
                    return false;
                }
                final var length = (int) Math.min(end - position,
                        (long) RECORDS_PER_CHUNK * QuadCatalogFormat.RECORD_LENGTH);
                try {
                    chunk = readFully(channel, position, length, path);
                } catch (final IOException e) {
                    throw new CatalogException("Failed to read quads from " + path + ": " + e.getMessage(), e);
                }
                position += length;
            }
            action.accept(decode(chunk));
            return true;
        }

        private QuadRecord decode(final ByteBuffer buffer) {
            final var ratios = QuadCatalogFormat.unpackRatios(buffer);
            final var largestDistance = buffer.getFloat();
            final var ra = buffer.getFloat();
            final var dec = buffer.getFloat();
            return new QuadRecord(ratios, largestDistance, EquatorialCoords.normalized(ra, dec));
        }
    }
}

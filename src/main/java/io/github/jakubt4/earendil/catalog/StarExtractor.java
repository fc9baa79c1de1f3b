package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.concurrent.ConcurrencyScheduler;
import io.github.jakubt4.earendil.sky.CelestialSphereIndex;
import io.github.jakubt4.earendil.sky.EquatorialCoords;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;
import java.util.zip.GZIPInputStream;

/**
 * Splits external catalog rows into one raw star file per sky cell.
 *
 * <p>Input files are newline-delimited text with RA, Dec and magnitude as the first three
 * numeric columns, separated by whitespace, commas or semicolons; {@code #} comment lines
 * and non-numeric header rows are skipped, {@code .gz} files are decompressed on the fly.
 *
 * <p>Each source file is one independent unit on the {@link ConcurrencyScheduler}. A worker
 * buffers records per cell and appends a full buffer to the shared cell file while holding
 * that cell's lock only, so workers writing to different cells never contend.
 * Records are appended; re-running into the same directory adds to the existing files.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StarExtractor {

    private static final Pattern SEPARATORS = Pattern.compile("[,;\\s]+");
    private static final int RECORDS_PER_FLUSH = 2048;

    private final CelestialSphereIndex sphereIndex;
    private final ConcurrencyScheduler scheduler;

    /**
     * @param sources      catalog shards
     * @param outputDir    directory for the {@code <cellId>.stars} files, created if missing
     * @param maxMagnitude stars fainter than this are dropped
     * @throws UncheckedIOException if the output cannot be written or any shard cannot be read;
     *                              the other shards are still processed to completion first
     */
    public ExtractionReport extract(final List<Path> sources, final Path outputDir, final float maxMagnitude) {
        try {
            Files.createDirectories(outputDir);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot create star output directory " + outputDir, e);
        }

        final var run = new ExtractionRun(outputDir, maxMagnitude);
        final var futures = sources.stream()
                .map(source -> scheduler.submit(() -> {
                    run.extractShard(source);
                    return source;
                }))
                .toList();

        final var failures = new ArrayList<Throwable>();
        for (final CompletableFuture<Path> future : futures) {
            try {
                final var done = future.join();
                log.debug("Shard {} extracted", done.getFileName());
            } catch (final CompletionException e) {
                log.error("Shard extraction failed: {}", e.getCause().getMessage());
                failures.add(e.getCause());
            }
        }
        run.closeSinks(failures);

        if (!failures.isEmpty()) {
            final var error = new UncheckedIOException(new IOException(
                    failures.size() + " of " + sources.size() + " catalog shards failed"));
            failures.forEach(error::addSuppressed);
            throw error;
        }

        final var report = run.report();
        log.info("Extraction complete — {} rows, {} stars written to {} cells, {} fainter than {}, {} rejected",
                report.rowsRead(), report.starsWritten(), report.starsPerCell().size(),
                report.starsFiltered(), maxMagnitude, report.rowsRejected());
        return report;
    }

    private static BufferedReader open(final Path source) throws IOException {
        final var raw = Files.newInputStream(source);
        try {
            final var in = source.getFileName().toString().endsWith(".gz") ? new GZIPInputStream(raw) : raw;
            return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        } catch (final IOException e) {
            raw.close();
            throw e;
        }
    }

    /** Shared state of one {@link #extract} call. */
    private final class ExtractionRun {

        private final Path outputDir;
        private final float maxMagnitude;
        private final ConcurrentHashMap<String, CellSink> sinks = new ConcurrentHashMap<>();
        private final ConcurrentHashMap<Integer, LongAdder> histogram = new ConcurrentHashMap<>();
        private final LongAdder rowsRead = new LongAdder();
        private final LongAdder filtered = new LongAdder();
        private final LongAdder rejected = new LongAdder();

        ExtractionRun(final Path outputDir, final float maxMagnitude) {
            this.outputDir = outputDir;
            this.maxMagnitude = maxMagnitude;
        }

        void extractShard(final Path source) throws IOException {
            final Map<String, ByteBuffer> buffers = new HashMap<>();
            try (var reader = open(source)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    final var star = parse(line);
                    if (star == null) {
                        continue;
                    }
                    final var cellId = sphereIndex.getCellAt(star.coords()).cellId();
                    final var buffer = buffers.computeIfAbsent(cellId,
                            id -> ByteBuffer.allocate(RECORDS_PER_FLUSH * StarRecord.BYTES));
                    star.writeTo(buffer);
                    histogram.computeIfAbsent((int) Math.floor(star.magnitude()), m -> new LongAdder()).increment();
                    if (!buffer.hasRemaining()) {
                        flush(cellId, buffer);
                    }
                }
            }
            for (final var entry : buffers.entrySet()) {
                flush(entry.getKey(), entry.getValue());
            }
        }

        private StarRecord parse(final String line) {
            final var trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                return null;
            }
            rowsRead.increment();
            final var columns = SEPARATORS.split(trimmed);
            if (columns.length < 3) {
                rejected.increment();
                return null;
            }
            final double ra;
            final double dec;
            final float magnitude;
            try {
                ra = Double.parseDouble(columns[0]);
                dec = Double.parseDouble(columns[1]);
                magnitude = Float.parseFloat(columns[2]);
            } catch (final NumberFormatException e) {
                log.debug("Skipping non-numeric row: {}", trimmed);
                rejected.increment();
                return null;
            }
            if (!(ra >= 0.0 && ra <= 360.0 && dec >= -90.0 && dec <= 90.0) || !Float.isFinite(magnitude)) {
                rejected.increment();
                return null;
            }
            if (magnitude > maxMagnitude) {
                filtered.increment();
                return null;
            }
            final var coords = EquatorialCoords.normalized(ra, dec);
            return new StarRecord(coords.ra(), coords.dec(), magnitude);
        }

        private void flush(final String cellId, final ByteBuffer buffer) {
            if (buffer.position() == 0) {
                return;
            }
            final var sink = sinks.computeIfAbsent(cellId,
                    id -> new CellSink(outputDir.resolve(id + StarRecord.FILE_EXTENSION)));
            sink.append(buffer.array(), buffer.position());
            buffer.clear();
        }

        void closeSinks(final List<Throwable> failures) {
            for (final var sink : sinks.values()) {
                try {
                    sink.close();
                } catch (final IOException e) {
                    log.error("Failed to close {}: {}", sink.path, e.getMessage());
                    failures.add(e);
                }
            }
        }

        ExtractionReport report() {
            final var perCell = new TreeMap<String, Long>();
            sinks.forEach((id, sink) -> perCell.put(id, sink.records));
            final var magnitudes = new TreeMap<Integer, Long>();
            histogram.forEach((mag, count) -> magnitudes.put(mag, count.sum()));
            final var written = perCell.values().stream().mapToLong(Long::longValue).sum();
            return new ExtractionReport(rowsRead.sum(), written, filtered.sum(), rejected.sum(), perCell, magnitudes);
        }
    }

    /**
     * Append-only output for one cell. All appends to the cell go through this object's monitor.
     */
    private static final class CellSink implements Closeable {

        private final Path path;
        private OutputStream out;
        private long records;

        CellSink(final Path path) {
            this.path = path;
        }

        synchronized void append(final byte[] data, final int length) {
            try {
                if (out == null) {
                    out = new BufferedOutputStream(Files.newOutputStream(path,
                            StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE));
                }
                out.write(data, 0, length);
                records += length / StarRecord.BYTES;
            } catch (final IOException e) {
                throw new UncheckedIOException("Failed to append to " + path, e);
            }
        }

        @Override
        public synchronized void close() throws IOException {
            if (out != null) {
                out.close();
            }
        }
    }
}

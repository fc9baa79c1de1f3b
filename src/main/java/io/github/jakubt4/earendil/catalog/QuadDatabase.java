package io.github.jakubt4.earendil.catalog;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * All cell files of one quad database directory, opened read-only for the lifetime
 * of the application and shared between concurrent solves.
 *
 * <p>Several files may cover the same cell (e.g. separately built pass ranges); their
 * passes are pooled and ordered by density. A file that fails to open is logged and
 * skipped so that one corrupt cell does not take the whole database down.
 */
@Slf4j
public class QuadDatabase implements AutoCloseable {

    private final List<QuadCatalogReader> readers;
    private final Map<String, List<CellPass>> passesByCell;
    private final List<Path> failedFiles;

    QuadDatabase(final List<QuadCatalogReader> readers, final List<Path> failedFiles) {
        this.readers = List.copyOf(readers);
        this.failedFiles = List.copyOf(failedFiles);

        final var byCell = new TreeMap<String, List<CellPass>>();
        for (final var reader : readers) {
            final var descriptor = reader.descriptor();
            final var passes = descriptor.passes();
            for (var i = 0; i < passes.size(); i++) {
                final var pass = passes.get(i);
                byCell.computeIfAbsent(descriptor.cellId(), id -> new ArrayList<>())
                        .add(new CellPass(descriptor.cellId(), reader, i, pass.density(), pass.recordCount()));
            }
        }
        byCell.values().forEach(list -> list.sort(Comparator.comparingDouble(CellPass::density)));
        this.passesByCell = byCell.entrySet().stream()
                .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, e -> List.copyOf(e.getValue())));
    }

    public static QuadDatabase empty() {
        return new QuadDatabase(List.of(), List.of());
    }

    /**
     * Opens every {@code *.qdb} file in {@code directory}.
     *
     * @throws UncheckedIOException if the directory cannot be listed
     */
    public static QuadDatabase open(final Path directory) {
        final List<Path> files;
        try (var listing = Files.list(directory)) {
            files = listing
                    .filter(p -> p.getFileName().toString().endsWith(QuadCatalogFormat.FILE_EXTENSION))
                    .sorted()
                    .toList();
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot list quad database directory " + directory, e);
        }

        final var readers = new ArrayList<QuadCatalogReader>();
        final var failed = new ArrayList<Path>();
        for (final var file : files) {
            try {
                readers.add(QuadCatalogReader.open(file));
            } catch (final CatalogException e) {
                log.error("Skipping catalog file {}: {}", file.getFileName(), e.getMessage());
                failed.add(file);
            }
        }

        final var database = new QuadDatabase(readers, failed);
        log.info("Quad database opened from {} — {} files, {} cells, {} failed",
                directory, readers.size(), database.cellIds().size(), failed.size());
        return database;
    }

    /** Passes available for the cell, ascending density; empty if the database has no data for it. */
    public List<CellPass> passesFor(final String cellId) {
        return passesByCell.getOrDefault(cellId, List.of());
    }

    public Set<String> cellIds() {
        return Collections.unmodifiableSet(passesByCell.keySet());
    }

    public List<Path> failedFiles() {
        return failedFiles;
    }

    public boolean isEmpty() {
        return passesByCell.isEmpty();
    }

    @Override
    public void close() {
        for (final var reader : readers) {
            try {
                reader.close();
            } catch (final CatalogException e) {
                log.warn("Failed to close {}: {}", reader.path(), e.getMessage());
            }
        }
    }
}

package io.github.jakubt4.earendil.catalog;

import java.util.SortedMap;

/**
 * Summary of a {@link StarExtractor} run.
 *
 * @param rowsRead           data rows seen, including rejected ones
 * @param starsWritten       records appended to cell files
 * @param starsFiltered      valid rows dropped for being fainter than the magnitude limit
 * @param rowsRejected       rows that were malformed or out of range
 * @param starsPerCell       records appended per cell id
 * @param magnitudeHistogram written stars per whole magnitude (floor)
 */
public record ExtractionReport(long rowsRead, long starsWritten, long starsFiltered, long rowsRejected,
                               SortedMap<String, Long> starsPerCell,
                               SortedMap<Integer, Long> magnitudeHistogram) {
}

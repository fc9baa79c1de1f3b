package io.github.jakubt4.earendil.runner;

import io.github.jakubt4.earendil.exception.SolverInputException;
import io.github.jakubt4.earendil.solver.ImageStar;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads detected stars from a text list, one star per line: {@code x y brightness [size]}.
 * Columns may be separated by whitespace or commas; blank lines and {@code #} comments are ignored.
 */
final class StarListReader {

    private static final Pattern SEPARATORS = Pattern.compile("[,\\s]+");

    private StarListReader() {
    }

    /**
     * @throws SolverInputException  on a malformed line, naming the line number
     * @throws UncheckedIOException  if the file cannot be read
     */
    static List<ImageStar> read(final Path file) {
        final List<String> lines;
        try {
            lines = Files.readAllLines(file);
        } catch (final IOException e) {
            throw new UncheckedIOException("Cannot read star list " + file, e);
        }
        final var stars = new ArrayList<ImageStar>(lines.size());
        for (var i = 0; i < lines.size(); i++) {
            final var line = lines.get(i).strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            final var columns = SEPARATORS.split(line);
            if (columns.length < 3) {
                throw new SolverInputException(file.getFileName() + ":" + (i + 1)
                        + ": expected 'x y brightness [size]', got '" + line + "'");
            }
            try {
                stars.add(new ImageStar(
                        Double.parseDouble(columns[0]),
                        Double.parseDouble(columns[1]),
                        Double.parseDouble(columns[2]),
                        columns.length > 3 ? Double.parseDouble(columns[3]) : 0.0));
            } catch (final NumberFormatException e) {
                throw new SolverInputException(file.getFileName() + ":" + (i + 1) + ": not a number in '" + line + "'");
            }
        }
        return stars;
    }
}

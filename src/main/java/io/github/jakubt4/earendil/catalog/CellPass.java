package io.github.jakubt4.earendil.catalog;

import java.util.stream.Stream;

/**
 * One density pass of one cell, bound to the open file it lives in.
 */
public record CellPass(String cellId, QuadCatalogReader reader, int passIndex, float density, int recordCount) {

    public Stream<QuadRecord> stream() {
        return reader.readPass(passIndex);
    }
}

package io.github.jakubt4.earendil.catalog;

import io.github.jakubt4.earendil.sky.Cell;

import java.util.List;

/**
 * Decoded header of a cell file.
 *
 * @param cellId    {@code bNNcMM} id of the cell the file covers
 * @param bandIndex band part of the id
 * @param cellIndex cell part of the id
 * @param passes    pass table, ascending density
 */
public record CellFileDescriptor(String cellId, int bandIndex, int cellIndex, List<PassDescriptor> passes) {

    public CellFileDescriptor(final int bandIndex, final int cellIndex, final List<PassDescriptor> passes) {
        this(Cell.formatId(bandIndex, cellIndex), bandIndex, cellIndex, List.copyOf(passes));
    }

    public int passCount() {
        return passes.size();
    }
}

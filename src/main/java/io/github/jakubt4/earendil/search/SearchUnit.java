package io.github.jakubt4.earendil.search;

import io.github.jakubt4.earendil.catalog.CellPass;
import io.github.jakubt4.earendil.sky.Cell;
import io.github.jakubt4.earendil.sky.EquatorialCoords;

/**
 * One (cell, density pass) pair to scan for a search circle. Lives for a single solve.
 */
public record SearchUnit(Cell cell, CellPass pass, EquatorialCoords center, double radius) {

    @Override
    public String toString() {
        return cell.cellId() + "/p" + pass.passIndex() + "@" + pass.density();
    }
}

package org.tessera.runtime.model;

import java.util.ArrayList;
import java.util.List;

/**
 * The rectangle a tile covers, in grid units.
 * <p>
 * The origin is always the upper-left corner of the rectangle, regardless of
 * the direction the tile was last grown or shrunk in.
 *
 * @param row        The origin row.
 * @param column     The origin column.
 * @param rowSpan    The number of rows covered, at least 1.
 * @param columnSpan The number of columns covered, at least 1.
 */
public record TileBounds(int row, int column, int rowSpan, int columnSpan) {

    public TileBounds {
        if (rowSpan < 1 || columnSpan < 1) {
            throw new IllegalArgumentException("Spans must be at least 1: " + rowSpan + "x" + columnSpan);
        }
    }

    /**
     * @return The first row below the rectangle (exclusive end).
     */
    public int endRow() {
        return row + rowSpan;
    }

    /**
     * @return The first column right of the rectangle (exclusive end).
     */
    public int endColumn() {
        return column + columnSpan;
    }

    public int area() {
        return rowSpan * columnSpan;
    }

    public boolean contains(int r, int c) {
        return r >= row && r < endRow() && c >= column && c < endColumn();
    }

    /**
     * Lists every cell of the rectangle in row-major order, origin first.
     *
     * @return A new mutable list of the covered cells.
     */
    public List<Cell> cells() {
        List<Cell> cells = new ArrayList<>(area());
        for (int r = row; r < endRow(); r++) {
            for (int c = column; c < endColumn(); c++) {
                cells.add(new Cell(r, c));
            }
        }
        return cells;
    }

    @Override
    public String toString() {
        return "(" + row + ", " + column + ") " + rowSpan + "x" + columnSpan;
    }
}

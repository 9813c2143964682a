package org.tessera.runtime.model;

/**
 * Thrown when a cell coordinate lies outside the grid.
 */
public class CellOutOfBoundsException extends IndexOutOfBoundsException {

    /**
     * Creates a new CellOutOfBoundsException for the given coordinate.
     *
     * @param row         The offending row.
     * @param column      The offending column.
     * @param rowCount    The number of rows in the grid.
     * @param columnCount The number of columns in the grid.
     */
    public CellOutOfBoundsException(int row, int column, int rowCount, int columnCount) {
        super(String.format("Cell (%d, %d) is outside the %dx%d grid", row, column, rowCount, columnCount));
    }

    /**
     * Creates a new CellOutOfBoundsException with the given message.
     *
     * @param message description of the offending coordinates.
     */
    public CellOutOfBoundsException(String message) {
        super(message);
    }
}

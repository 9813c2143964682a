package org.tessera.runtime.model;

/**
 * Addresses a single unit cell of a {@link TileGrid}.
 *
 * @param row    The zero-based row index.
 * @param column The zero-based column index.
 */
public record Cell(int row, int column) {

    @Override
    public String toString() {
        return "(" + row + ", " + column + ")";
    }
}

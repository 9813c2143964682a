package org.tessera.runtime.model;

/**
 * One rectangular region of a {@link TileGrid}, filled or empty.
 * <p>
 * A tile keeps its id for its whole life; merges and shrinks update its
 * geometry in place. Only {@link TileGrid} changes the geometry, and only the
 * layout changes the fill state.
 */
public final class Tile {
    private final int id;
    private int row;
    private int column;
    private int rowSpan;
    private int columnSpan;
    private boolean filled;

    Tile(int id, int row, int column, int rowSpan, int columnSpan) {
        this.id = id;
        this.row = row;
        this.column = column;
        this.rowSpan = rowSpan;
        this.columnSpan = columnSpan;
    }

    public int getId() {
        return id;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public int getRowSpan() {
        return rowSpan;
    }

    public int getColumnSpan() {
        return columnSpan;
    }

    public boolean isFilled() {
        return filled;
    }

    public void setFilled(boolean filled) {
        this.filled = filled;
    }

    public boolean isUnit() {
        return rowSpan == 1 && columnSpan == 1;
    }

    public TileBounds getBounds() {
        return new TileBounds(row, column, rowSpan, columnSpan);
    }

    void updateSize(TileBounds bounds) {
        this.row = bounds.row();
        this.column = bounds.column();
        this.rowSpan = bounds.rowSpan();
        this.columnSpan = bounds.columnSpan();
    }

    @Override
    public String toString() {
        return "Tile#" + id + getBounds() + (filled ? " filled" : "");
    }
}

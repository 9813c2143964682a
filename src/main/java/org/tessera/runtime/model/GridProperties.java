package org.tessera.runtime.model;

import com.typesafe.config.Config;

/**
 * Represents the properties of a tile grid without the tile data.
 * <p>
 * The dimensions are interpreted by the engine. The spans and spacings are
 * display values the engine only stores and forwards to the rendering side:
 * the minimum pixel height of a row, the minimum pixel width of a column and
 * the pixel gaps between neighboring tiles.
 */
public final class GridProperties {
    private final int rowCount;
    private final int columnCount;
    private final int verticalSpan;
    private final int horizontalSpan;
    private final int verticalSpacing;
    private final int horizontalSpacing;

    /**
     * Creates new grid properties.
     *
     * @param rowCount          The number of rows, must be positive.
     * @param columnCount       The number of columns, must be positive.
     * @param verticalSpan      The minimum row height handed to the renderer.
     * @param horizontalSpan    The minimum column width handed to the renderer.
     * @param verticalSpacing   The vertical gap between tiles handed to the renderer.
     * @param horizontalSpacing The horizontal gap between tiles handed to the renderer.
     * @throws IllegalArgumentException if a dimension is not positive.
     */
    public GridProperties(int rowCount, int columnCount, int verticalSpan, int horizontalSpan,
                          int verticalSpacing, int horizontalSpacing) {
        if (rowCount <= 0 || columnCount <= 0) {
            throw new IllegalArgumentException(
                "Grid dimensions must be positive, got " + rowCount + "x" + columnCount);
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.verticalSpan = verticalSpan;
        this.horizontalSpan = horizontalSpan;
        this.verticalSpacing = verticalSpacing;
        this.horizontalSpacing = horizontalSpacing;
    }

    /**
     * Creates grid properties with the given dimensions and the default display values.
     *
     * @param rowCount    The number of rows.
     * @param columnCount The number of columns.
     */
    public GridProperties(int rowCount, int columnCount) {
        this(rowCount, columnCount, 100, 150, 5, 5);
    }

    /**
     * Config-based constructor.
     *
     * @param config Configuration object containing the layout parameters
     *               ({@code rowCount}, {@code columnCount}, {@code verticalSpan},
     *               {@code horizontalSpan}, {@code verticalSpacing}, {@code horizontalSpacing}).
     */
    public GridProperties(Config config) {
        this(
            config.getInt("rowCount"),
            config.getInt("columnCount"),
            config.getInt("verticalSpan"),
            config.getInt("horizontalSpan"),
            config.getInt("verticalSpacing"),
            config.getInt("horizontalSpacing")
        );
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public int getVerticalSpan() {
        return verticalSpan;
    }

    public int getHorizontalSpan() {
        return horizontalSpan;
    }

    public int getVerticalSpacing() {
        return verticalSpacing;
    }

    public int getHorizontalSpacing() {
        return horizontalSpacing;
    }

    public int getCellCount() {
        return rowCount * columnCount;
    }

    public boolean isInside(int row, int column) {
        return row >= 0 && row < rowCount && column >= 0 && column < columnCount;
    }

    /**
     * Checks whether a rectangle lies completely inside the grid.
     *
     * @return {@code false} for negative origins, non-positive spans or rectangles crossing the far edges.
     */
    public boolean isInside(int row, int column, int rowSpan, int columnSpan) {
        return row >= 0 && column >= 0 && rowSpan > 0 && columnSpan > 0
            && rowSpan <= rowCount - row && columnSpan <= columnCount - column;
    }

    public GridProperties withVerticalSpan(int span) {
        return new GridProperties(rowCount, columnCount, span, horizontalSpan, verticalSpacing, horizontalSpacing);
    }

    public GridProperties withHorizontalSpan(int span) {
        return new GridProperties(rowCount, columnCount, verticalSpan, span, verticalSpacing, horizontalSpacing);
    }

    public GridProperties withVerticalSpacing(int spacing) {
        return new GridProperties(rowCount, columnCount, verticalSpan, horizontalSpan, spacing, horizontalSpacing);
    }

    public GridProperties withHorizontalSpacing(int spacing) {
        return new GridProperties(rowCount, columnCount, verticalSpan, horizontalSpan, verticalSpacing, spacing);
    }

    @Override
    public String toString() {
        return "GridProperties[" + rowCount + "x" + columnCount
            + ", span=" + verticalSpan + "/" + horizontalSpan
            + ", spacing=" + verticalSpacing + "/" + horizontalSpacing + "]";
    }
}

package org.tessera.runtime.model;

/**
 * Names the edge of a tile that moves during a resize.
 * <p>
 * Each constant carries its unit vector: {@code dx} steps along columns and
 * {@code dy} steps along rows. North and west point toward the grid origin, so
 * moving those edges also moves the tile's origin.
 */
public enum Direction {
    /**
     * The top edge; travels toward row 0.
     */
    NORTH(0, -1),

    /**
     * The bottom edge; travels toward the last row.
     */
    SOUTH(0, 1),

    /**
     * The right edge; travels toward the last column.
     */
    EAST(1, 0),

    /**
     * The left edge; travels toward column 0.
     */
    WEST(-1, 0);

    private final int dx;
    private final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /**
     * @return {@code true} for north and south, which change the row span.
     */
    public boolean isVertical() {
        return dy != 0;
    }

    /**
     * @return {@code true} for north and west, whose edge is the tile's origin edge.
     */
    public boolean isTowardOrigin() {
        return dx + dy < 0;
    }

    /**
     * Converts a signed displacement along this direction's axis into outward units.
     * <p>
     * Pointer input reports displacements in grid coordinates (e.g. -2 columns when
     * the west edge is dragged two cells to the left). Positive results grow the
     * tile, negative results shrink it.
     *
     * @param displacement The signed displacement in cells along the axis.
     * @return The number of units the edge moves outward.
     */
    public int outwardUnits(int displacement) {
        return displacement * (dx + dy);
    }

    /**
     * Resolves a unit vector to its direction.
     *
     * @param dx The column step, -1, 0 or 1.
     * @param dy The row step, -1, 0 or 1.
     * @return The matching direction.
     * @throws IllegalArgumentException if the vector is not a unit vector along one axis.
     */
    public static Direction fromVector(int dx, int dy) {
        for (Direction direction : values()) {
            if (direction.dx == dx && direction.dy == dy) {
                return direction;
            }
        }
        throw new IllegalArgumentException("Not a unit direction vector: (" + dx + ", " + dy + ")");
    }
}

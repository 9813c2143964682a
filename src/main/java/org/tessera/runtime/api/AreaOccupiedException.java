package org.tessera.runtime.api;

import org.tessera.runtime.model.TileBounds;

/**
 * Thrown when a placement target overlaps a filled tile.
 */
public class AreaOccupiedException extends TileLayoutException {

    private final TileBounds area;

    /**
     * Creates a new AreaOccupiedException for the rejected rectangle.
     *
     * @param area The requested rectangle.
     */
    public AreaOccupiedException(TileBounds area) {
        super("Area " + area + " overlaps a filled tile");
        this.area = area;
    }

    public TileBounds getArea() {
        return area;
    }
}

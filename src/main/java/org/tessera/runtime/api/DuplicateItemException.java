package org.tessera.runtime.api;

/**
 * Thrown when an item that is already placed is placed again.
 */
public class DuplicateItemException extends TileLayoutException {

    /**
     * @param item The item that is already bound to a tile.
     */
    public DuplicateItemException(Object item) {
        super("Item is already placed: " + item);
    }
}

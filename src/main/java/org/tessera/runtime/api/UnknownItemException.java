package org.tessera.runtime.api;

/**
 * Thrown when an item that is not placed is removed, moved or resized.
 */
public class UnknownItemException extends TileLayoutException {

    /**
     * @param item The item that is not bound to any tile.
     */
    public UnknownItemException(Object item) {
        super("Item is not placed: " + item);
    }
}

package org.tessera.runtime.api;

/**
 * Base class of the checked errors a {@link TileLayout} reports.
 * <p>
 * Every such error is detected before the layout is mutated, so a failed call
 * leaves the layout exactly as it was.
 */
public abstract class TileLayoutException extends Exception {

    /**
     * @param message The detail message.
     */
    protected TileLayoutException(String message) {
        super(message);
    }
}

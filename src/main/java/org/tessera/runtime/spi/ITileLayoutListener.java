package org.tessera.runtime.spi;

import org.tessera.runtime.model.GridProperties;
import org.tessera.runtime.model.TileBounds;

/**
 * Receives layout changes the presentation side needs to follow.
 * <p>
 * Callbacks run synchronously on the thread that mutated the layout, after the
 * mutation is complete.
 *
 * @param <T> The item handle type.
 */
public interface ITileLayoutListener<T> {

    /**
     * Called after the tile hosting {@code item} grew or shrank by at least one unit.
     *
     * @param item   The resized item.
     * @param bounds The tile's new rectangle.
     */
    default void onTileResized(T item, TileBounds bounds) {
    }

    /**
     * Called after {@code item} was dropped at a new position.
     *
     * @param item   The moved item.
     * @param bounds The tile's new rectangle.
     */
    default void onTileMoved(T item, TileBounds bounds) {
    }

    /**
     * Called after a display value (span or spacing) changed.
     *
     * @param properties The updated grid properties.
     */
    default void onGeometryChanged(GridProperties properties) {
    }
}

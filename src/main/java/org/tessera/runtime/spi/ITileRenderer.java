package org.tessera.runtime.spi;

import org.tessera.runtime.api.TileLayout;

/**
 * A rendering surface for a layout.
 * <p>
 * Implementations read tile rectangles in grid units from the layout and own all
 * pixel, color and text concerns.
 *
 * @param <T> The item handle type.
 */
@FunctionalInterface
public interface ITileRenderer<T> {

    /**
     * Renders the current state of a layout.
     *
     * @param layout The layout to render.
     * @return The rendered representation.
     */
    String render(TileLayout<T> layout);
}

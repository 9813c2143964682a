package org.tessera.runtime.internal.services;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import org.tessera.runtime.model.Tile;

/**
 * Bidirectional binding between placed items and the tiles hosting them.
 * <p>
 * Tiles are referenced by id so that the binding survives in-place geometry
 * changes. Items are compared with {@code equals}. Binding order is kept for
 * {@link #items()}.
 *
 * @param <T> The item handle type.
 */
public final class ItemTileRegistry<T> {

    private final Map<T, Integer> tileIdsByItem = new LinkedHashMap<>();
    private final Int2ObjectMap<T> itemsByTileId = new Int2ObjectOpenHashMap<>();

    /**
     * Binds an item to a tile.
     *
     * @param item The item handle.
     * @param tile The tile hosting the item.
     * @throws IllegalStateException if the item or the tile is already bound.
     */
    public void bind(T item, Tile tile) {
        Objects.requireNonNull(item, "item");
        if (tileIdsByItem.containsKey(item)) {
            throw new IllegalStateException("Item is already bound: " + item);
        }
        if (itemsByTileId.containsKey(tile.getId())) {
            throw new IllegalStateException("Tile #" + tile.getId() + " already hosts " + itemsByTileId.get(tile.getId()));
        }
        tileIdsByItem.put(item, tile.getId());
        itemsByTileId.put(tile.getId(), item);
    }

    /**
     * Removes the binding of an item.
     *
     * @param item The item handle.
     * @return The id of the tile the item was bound to, or {@code -1} if it was not bound.
     */
    public int unbind(T item) {
        Integer tileId = tileIdsByItem.remove(item);
        if (tileId == null) {
            return -1;
        }
        itemsByTileId.remove(tileId.intValue());
        return tileId;
    }

    /**
     * Removes the binding of whatever item a tile hosts.
     *
     * @param tileId The tile id.
     * @return The item that was bound, or {@code null}.
     */
    public T unbindTile(int tileId) {
        T item = itemsByTileId.remove(tileId);
        if (item != null) {
            tileIdsByItem.remove(item);
        }
        return item;
    }

    /**
     * @return The id of the tile hosting the item, or {@code -1} if it is not bound.
     */
    public int tileOf(T item) {
        Integer tileId = tileIdsByItem.get(item);
        return tileId != null ? tileId : -1;
    }

    /**
     * @return The item hosted by the tile, or {@code null}.
     */
    public T itemOf(int tileId) {
        return itemsByTileId.get(tileId);
    }

    public boolean contains(T item) {
        return tileIdsByItem.containsKey(item);
    }

    public int size() {
        return tileIdsByItem.size();
    }

    /**
     * @return The bound items in binding order.
     */
    public List<T> items() {
        return new ArrayList<>(tileIdsByItem.keySet());
    }
}

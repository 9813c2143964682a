package org.tessera.cli.rendering;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.tessera.runtime.api.TileLayout;
import org.tessera.runtime.model.Tile;
import org.tessera.runtime.model.TileBounds;
import org.tessera.runtime.spi.ITileRenderer;

/**
 * Writes a layout as a JSON document listing every tile in grid units.
 */
public class JsonTileRenderer<T> implements ITileRenderer<T> {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    @Override
    public String render(TileLayout<T> layout) {
        JsonObject root = new JsonObject();
        root.addProperty("rowCount", layout.rowCount());
        root.addProperty("columnCount", layout.columnCount());
        JsonArray tiles = new JsonArray();
        for (Tile tile : layout.tiles()) {
            TileBounds bounds = tile.getBounds();
            JsonObject json = new JsonObject();
            json.addProperty("row", bounds.row());
            json.addProperty("column", bounds.column());
            json.addProperty("rowSpan", bounds.rowSpan());
            json.addProperty("columnSpan", bounds.columnSpan());
            json.addProperty("filled", tile.isFilled());
            layout.itemOf(tile).ifPresent(item -> json.addProperty("item", String.valueOf(item)));
            tiles.add(json);
        }
        root.add("tiles", tiles);
        return gson.toJson(root);
    }
}

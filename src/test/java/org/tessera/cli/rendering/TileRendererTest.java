package org.tessera.cli.rendering;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tessera.runtime.api.TileLayout;
import org.tessera.runtime.model.Direction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TileRendererTest {

    @Test
    void asciiDrawsOneBoxPerTile() throws Exception {
        TileLayout<String> layout = new TileLayout<>(1, 2);
        layout.place("A", 0, 0);
        String nl = System.lineSeparator();

        String rendered = new AsciiTileRenderer<String>(4, 2).render(layout);

        assertThat(rendered).isEqualTo(
            "+---+---+" + nl
                + "| A | . |" + nl
                + "+---+---+" + nl);
    }

    @Test
    void asciiDrawsMergedTilesWithoutInnerBorders() throws Exception {
        TileLayout<String> layout = new TileLayout<>(2, 2);
        layout.place("wide", 0, 0, 1, 2);
        layout.resize("wide", Direction.SOUTH, 1);
        String nl = System.lineSeparator();

        String rendered = new AsciiTileRenderer<String>(4, 2).render(layout);

        assertThat(rendered).isEqualTo(
            "+-------+" + nl
                + "| wide  |" + nl
                + "|       |" + nl
                + "|       |" + nl
                + "+-------+" + nl);
    }

    @Test
    void asciiRejectsTooSmallCells() {
        assertThatThrownBy(() -> new AsciiTileRenderer<String>(1, 2)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jsonOmitsItemForEmptyTiles() throws Exception {
        TileLayout<Integer> layout = new TileLayout<>(1, 2);
        layout.place(7, 0, 1);

        JsonObject root = JsonParser.parseString(new JsonTileRenderer<Integer>().render(layout)).getAsJsonObject();

        JsonObject first = root.getAsJsonArray("tiles").get(0).getAsJsonObject();
        JsonObject second = root.getAsJsonArray("tiles").get(1).getAsJsonObject();
        assertThat(first.has("item")).isFalse();
        assertThat(second.get("item").getAsString()).isEqualTo("7");
        assertThat(second.get("filled").getAsBoolean()).isTrue();
    }
}

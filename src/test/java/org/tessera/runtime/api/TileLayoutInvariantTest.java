package org.tessera.runtime.api;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.tessera.runtime.model.Cell;
import org.tessera.runtime.model.CellOutOfBoundsException;
import org.tessera.runtime.model.Direction;
import org.tessera.runtime.model.Tile;
import org.tessera.runtime.model.TileBounds;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Drives a layout through a long random sequence of operations and checks after
 * every step that the tiles still partition the grid and the item bindings agree
 * with the filled tiles.
 */
@Tag("unit")
class TileLayoutInvariantTest {

    private static final Direction[] DIRECTIONS = Direction.values();

    @Test
    void randomOperationsKeepThePartition() throws Exception {
        Random random = new Random(42L);
        TileLayout<String> layout = new TileLayout<>(7, 5);
        int nextItem = 0;

        for (int step = 0; step < 3000; step++) {
            List<String> items = layout.items();
            int operation = random.nextInt(6);
            try {
                switch (operation) {
                    case 0 -> layout.place("item-" + nextItem++, random.nextInt(7), random.nextInt(5),
                        1 + random.nextInt(3), 1 + random.nextInt(3));
                    case 1 -> {
                        if (!items.isEmpty()) {
                            layout.remove(items.get(random.nextInt(items.size())));
                        }
                    }
                    case 2 -> {
                        if (!items.isEmpty()) {
                            String item = items.get(random.nextInt(items.size()));
                            TileBounds before = layout.tileBoundsOf(item);
                            int granted = layout.resize(item, DIRECTIONS[random.nextInt(4)], random.nextInt(7) - 3);
                            TileBounds after = layout.tileBoundsOf(item);
                            assertThat(after.area() == before.area()).isEqualTo(granted == 0);
                        }
                    }
                    case 3 -> {
                        if (!items.isEmpty()) {
                            String item = items.get(random.nextInt(items.size()));
                            TileBounds before = layout.tileBoundsOf(item);
                            boolean moved = layout.move(item, random.nextInt(7), random.nextInt(5));
                            TileBounds after = layout.tileBoundsOf(item);
                            assertThat(after.rowSpan()).isEqualTo(before.rowSpan());
                            assertThat(after.columnSpan()).isEqualTo(before.columnSpan());
                            if (!moved) {
                                assertThat(after).isEqualTo(before);
                            }
                        }
                    }
                    case 4 -> layout.resizeTile(random.nextInt(7), random.nextInt(5),
                        DIRECTIONS[random.nextInt(4)], random.nextInt(5) - 2);
                    default -> {
                        if (random.nextInt(10) == 0) {
                            int row = random.nextInt(7);
                            int column = random.nextInt(5);
                            layout.hardSplit(row, column, List.of(new Cell(row, column)));
                        }
                    }
                }
            } catch (AreaOccupiedException | CellOutOfBoundsException expected) {
                // Random placements regularly collide or leave the grid.
            }
            assertConsistent(layout);
        }
    }

    private static void assertConsistent(TileLayout<String> layout) throws UnknownItemException {
        layout.getGrid().verifyPartition();

        int covered = 0;
        List<Tile> filled = new ArrayList<>();
        for (Tile tile : layout.tiles()) {
            covered += tile.getBounds().area();
            if (tile.isFilled()) {
                filled.add(tile);
            }
        }
        assertThat(covered).isEqualTo(layout.rowCount() * layout.columnCount());
        assertThat(filled).hasSameSizeAs(layout.items());
        for (String item : layout.items()) {
            TileBounds bounds = layout.tileBoundsOf(item);
            assertThat(layout.itemAt(bounds.row(), bounds.column())).contains(item);
            assertThat(layout.isFilled(bounds.row(), bounds.column())).isTrue();
        }
    }
}

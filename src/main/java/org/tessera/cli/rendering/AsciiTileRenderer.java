package org.tessera.cli.rendering;

import java.util.Arrays;

import org.tessera.runtime.api.TileLayout;
import org.tessera.runtime.model.Tile;
import org.tessera.runtime.model.TileBounds;
import org.tessera.runtime.spi.ITileRenderer;

/**
 * Draws a layout as boxes of text, one box per tile.
 * <p>
 * Each unit cell takes {@code cellWidth} x {@code cellHeight} characters. Filled
 * tiles show their item's text on the first inner line; empty tiles show a dot.
 */
public class AsciiTileRenderer<T> implements ITileRenderer<T> {

    private static final char CORNER = '+';
    private static final char HORIZONTAL = '-';
    private static final char VERTICAL = '|';
    private static final String EMPTY_LABEL = ".";

    private final int cellWidth;
    private final int cellHeight;

    public AsciiTileRenderer() {
        this(12, 2);
    }

    /**
     * @param cellWidth  Characters per unit column, at least 2.
     * @param cellHeight Lines per unit row, at least 2.
     */
    public AsciiTileRenderer(int cellWidth, int cellHeight) {
        if (cellWidth < 2 || cellHeight < 2) {
            throw new IllegalArgumentException("Cells need at least 2x2 characters, got " + cellWidth + "x" + cellHeight);
        }
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
    }

    @Override
    public String render(TileLayout<T> layout) {
        char[][] canvas = new char[layout.rowCount() * cellHeight + 1][layout.columnCount() * cellWidth + 1];
        for (char[] line : canvas) {
            Arrays.fill(line, ' ');
        }
        for (Tile tile : layout.tiles()) {
            String label = layout.itemOf(tile).map(String::valueOf).orElse(EMPTY_LABEL);
            drawTile(canvas, tile.getBounds(), label);
        }
        StringBuilder sb = new StringBuilder();
        for (char[] line : canvas) {
            sb.append(new String(line).stripTrailing()).append(System.lineSeparator());
        }
        return sb.toString();
    }

    private void drawTile(char[][] canvas, TileBounds bounds, String label) {
        int top = bounds.row() * cellHeight;
        int bottom = bounds.endRow() * cellHeight;
        int left = bounds.column() * cellWidth;
        int right = bounds.endColumn() * cellWidth;

        for (int x = left; x <= right; x++) {
            canvas[top][x] = HORIZONTAL;
            canvas[bottom][x] = HORIZONTAL;
        }
        for (int y = top; y <= bottom; y++) {
            canvas[y][left] = VERTICAL;
            canvas[y][right] = VERTICAL;
        }
        canvas[top][left] = CORNER;
        canvas[top][right] = CORNER;
        canvas[bottom][left] = CORNER;
        canvas[bottom][right] = CORNER;

        int room = right - left - 1;
        String text = label.length() > room ? label.substring(0, room) : label;
        int start = left + 1 + (room - text.length()) / 2;
        text.getChars(0, text.length(), canvas[top + 1], start);
    }
}

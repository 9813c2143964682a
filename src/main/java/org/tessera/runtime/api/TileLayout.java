package org.tessera.runtime.api;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.runtime.internal.services.ItemTileRegistry;
import org.tessera.runtime.internal.services.ResizePlan;
import org.tessera.runtime.internal.services.ResizeResolver;
import org.tessera.runtime.model.Cell;
import org.tessera.runtime.model.CellOutOfBoundsException;
import org.tessera.runtime.model.Direction;
import org.tessera.runtime.model.GridProperties;
import org.tessera.runtime.model.Tile;
import org.tessera.runtime.model.TileBounds;
import org.tessera.runtime.model.TileGrid;
import org.tessera.runtime.spi.ITileLayoutListener;

/**
 * A grid layout in which items occupy rectangular tiles that can be placed,
 * removed, moved and resized.
 * <p>
 * The layout divides a fixed grid into non-overlapping rectangular tiles. An
 * item placed over a block of cells merges those cells into one tile; removing
 * it splits the tile back into unit tiles. Resizing moves one edge of an item's
 * tile and grants only as many cells as are free.
 * <p>
 * All checked errors are detected before anything is mutated. The layout is not
 * thread-safe; callers serialize access.
 *
 * @param <T> The item handle type. Items are compared with {@code equals}.
 */
public class TileLayout<T> {

    private static final Logger LOG = LoggerFactory.getLogger(TileLayout.class);

    private final TileGrid grid;
    private final ResizeResolver resizeResolver;
    private final ItemTileRegistry<T> registry = new ItemTileRegistry<>();
    private final List<ITileLayoutListener<T>> listeners = new ArrayList<>();

    private GridProperties properties;
    private boolean dragAndDrop = true;
    private boolean resizable = true;
    private T itemToDrop;

    /**
     * Creates an empty layout.
     *
     * @param properties The grid dimensions and display values.
     */
    public TileLayout(GridProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.grid = new TileGrid(properties);
        this.resizeResolver = new ResizeResolver(grid);
    }

    /**
     * Creates an empty layout with default display values.
     *
     * @param rowCount    The number of rows.
     * @param columnCount The number of columns.
     */
    public TileLayout(int rowCount, int columnCount) {
        this(new GridProperties(rowCount, columnCount));
    }

    /**
     * Config-based constructor.
     *
     * @param config The layout section, see {@link GridProperties#GridProperties(Config)};
     *               the optional flags {@code dragAndDrop} and {@code resizable} set the
     *               interaction policy.
     */
    public TileLayout(Config config) {
        this(new GridProperties(config));
        if (config.hasPath("dragAndDrop")) {
            this.dragAndDrop = config.getBoolean("dragAndDrop");
        }
        if (config.hasPath("resizable")) {
            this.resizable = config.getBoolean("resizable");
        }
    }

    // ========================================================================
    // Placement
    // ========================================================================

    /**
     * Places an item on a single cell.
     *
     * @see #place(Object, int, int, int, int)
     */
    public TileBounds place(T item, int row, int column) throws DuplicateItemException, AreaOccupiedException {
        return place(item, row, column, 1, 1);
    }

    /**
     * Places an item over a rectangular block of cells.
     * <p>
     * The covered cells are merged into the tile at {@code (row, column)}, which
     * becomes filled and bound to the item.
     *
     * @param item       The item to place.
     * @param row        The origin row.
     * @param column     The origin column.
     * @param rowSpan    The number of rows to cover, at least 1.
     * @param columnSpan The number of columns to cover, at least 1.
     * @return The rectangle of the item's tile.
     * @throws DuplicateItemException   if the item is already placed.
     * @throws AreaOccupiedException    if a covered cell belongs to a filled tile.
     * @throws CellOutOfBoundsException if the rectangle exceeds the grid.
     * @throws IllegalArgumentException if a span is less than 1.
     */
    public TileBounds place(T item, int row, int column, int rowSpan, int columnSpan)
            throws DuplicateItemException, AreaOccupiedException {
        Objects.requireNonNull(item, "item");
        if (registry.contains(item)) {
            throw new DuplicateItemException(item);
        }
        TileBounds area = new TileBounds(row, column, rowSpan, columnSpan);
        requireInside(area);
        if (!isAreaEmpty(row, column, rowSpan, columnSpan)) {
            throw new AreaOccupiedException(area);
        }
        Tile tile = occupy(item, area);
        LOG.debug("Placed {} on tile #{} at {}", item, tile.getId(), area);
        return area;
    }

    /**
     * Removes an item and splits its tile back into unit tiles.
     *
     * @param item The item to remove.
     * @return The rectangle the item covered.
     * @throws UnknownItemException if the item is not placed.
     */
    public TileBounds remove(T item) throws UnknownItemException {
        Tile tile = requireTile(item);
        TileBounds bounds = tile.getBounds();
        registry.unbind(item);
        grid.splitOut(bounds.cells());
        LOG.debug("Removed {} from {}", item, bounds);
        return bounds;
    }

    /**
     * Splits the listed cells into unfilled unit tiles and returns the tile now at {@code (row, column)}.
     * <p>
     * A tile that is only partly listed is split over its full extent. Items hosted by
     * split tiles are unbound.
     *
     * @param row          The row of the cell to return.
     * @param column       The column of the cell to return.
     * @param cellsToSplit The cells to split; must contain {@code (row, column)}.
     * @return The unit tile at {@code (row, column)} after the split.
     * @throws IllegalArgumentException if {@code (row, column)} is not listed.
     * @throws CellOutOfBoundsException if a listed cell lies outside the grid.
     */
    public Tile hardSplit(int row, int column, Collection<Cell> cellsToSplit) {
        if (!cellsToSplit.contains(new Cell(row, column))) {
            throw new IllegalArgumentException("Cell (" + row + ", " + column + ") is not among the cells to split");
        }
        Set<Tile> touched = new LinkedHashSet<>();
        for (Cell cell : cellsToSplit) {
            touched.add(grid.ownerOf(cell));
        }
        Set<Cell> cells = new LinkedHashSet<>();
        for (Tile tile : touched) {
            cells.addAll(tile.getBounds().cells());
            T evicted = registry.unbindTile(tile.getId());
            if (evicted != null) {
                LOG.debug("Hard split evicted {} from {}", evicted, tile.getBounds());
            }
        }
        grid.splitOut(cells);
        return grid.ownerOf(row, column);
    }

    /**
     * Moves an item so that its tile's origin lands on {@code (targetRow, targetColumn)}.
     * <p>
     * The item keeps its span. The move is admissible if the target rectangle lies
     * inside the grid and each of its cells is unfilled or belongs to the item itself.
     *
     * @param item         The item to move.
     * @param targetRow    The new origin row.
     * @param targetColumn The new origin column.
     * @return {@code true} if the item now sits at the target, {@code false} if the drop
     *         was refused and nothing changed.
     * @throws UnknownItemException if the item is not placed.
     */
    public boolean move(T item, int targetRow, int targetColumn) throws UnknownItemException {
        Tile tile = requireTile(item);
        if (!dragAndDrop) {
            LOG.debug("Drag and drop disabled, ignoring move of {}", item);
            return false;
        }
        TileBounds source = tile.getBounds();
        if (!properties.isInside(targetRow, targetColumn, source.rowSpan(), source.columnSpan())) {
            return false;
        }
        TileBounds target = new TileBounds(targetRow, targetColumn, source.rowSpan(), source.columnSpan());
        if (target.equals(source)) {
            return true;
        }
        for (Cell cell : target.cells()) {
            Tile owner = grid.ownerOf(cell);
            if (owner != tile && owner.isFilled()) {
                return false;
            }
        }
        registry.unbind(item);
        grid.splitOut(source.cells());
        occupy(item, target);
        LOG.debug("Moved {} from {} to {}", item, source, target);
        for (ITileLayoutListener<T> listener : List.copyOf(listeners)) {
            listener.onTileMoved(item, target);
        }
        return true;
    }

    /**
     * Checks whether a rectangle lies inside the grid and covers no filled tile.
     *
     * @return {@code false} if the rectangle leaves the grid or overlaps a filled tile.
     */
    public boolean isAreaEmpty(int row, int column, int rowSpan, int columnSpan) {
        if (!properties.isInside(row, column, rowSpan, columnSpan)) {
            return false;
        }
        for (int r = row; r < row + rowSpan; r++) {
            for (int c = column; c < column + columnSpan; c++) {
                if (grid.isFilled(r, c)) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * @throws CellOutOfBoundsException if the cell lies outside the grid.
     */
    public boolean isFilled(int row, int column) {
        return grid.isFilled(row, column);
    }

    // ========================================================================
    // Resizing
    // ========================================================================

    /**
     * Moves one edge of an item's tile.
     *
     * @param item      The item whose tile is resized.
     * @param direction The edge to move.
     * @param units     The outward movement in cells; negative values shrink.
     * @return The granted movement: 0 if nothing changed, otherwise of the same sign as {@code units}.
     * @throws UnknownItemException if the item is not placed.
     */
    public int resize(T item, Direction direction, int units) throws UnknownItemException {
        return resize(requireTile(item), direction, units);
    }

    /**
     * Moves one edge of the tile covering {@code (row, column)}, filled or not.
     *
     * @see #resize(Object, Direction, int)
     * @throws CellOutOfBoundsException if the cell lies outside the grid.
     */
    public int resizeTile(int row, int column, Direction direction, int units) {
        return resize(grid.ownerOf(row, column), direction, units);
    }

    private int resize(Tile tile, Direction direction, int units) {
        if (!resizable) {
            LOG.debug("Resizing disabled, ignoring resize of tile #{}", tile.getId());
            return 0;
        }
        ResizePlan plan = resizeResolver.resize(tile, direction, units);
        if (plan.isNoOp()) {
            return 0;
        }
        T item = registry.itemOf(tile.getId());
        if (item != null) {
            for (ITileLayoutListener<T> listener : List.copyOf(listeners)) {
                listener.onTileResized(item, plan.resultingBounds());
            }
        }
        return plan.grantedUnits();
    }

    // ========================================================================
    // Queries
    // ========================================================================

    public int rowCount() {
        return properties.getRowCount();
    }

    public int columnCount() {
        return properties.getColumnCount();
    }

    /**
     * Gets the rectangle of the tile covering a cell.
     *
     * @throws CellOutOfBoundsException if the cell lies outside the grid.
     */
    public TileBounds tileRect(int row, int column) {
        return grid.ownerOf(row, column).getBounds();
    }

    /**
     * @throws UnknownItemException if the item is not placed.
     */
    public TileBounds tileBoundsOf(T item) throws UnknownItemException {
        return requireTile(item).getBounds();
    }

    /**
     * Gets the item hosted by the tile covering a cell.
     *
     * @throws CellOutOfBoundsException if the cell lies outside the grid.
     */
    public Optional<T> itemAt(int row, int column) {
        return Optional.ofNullable(registry.itemOf(grid.ownerOf(row, column).getId()));
    }

    /**
     * Gets the item hosted by a tile.
     */
    public Optional<T> itemOf(Tile tile) {
        return Optional.ofNullable(registry.itemOf(tile.getId()));
    }

    public boolean contains(T item) {
        return registry.contains(item);
    }

    /**
     * @return The placed items in placement order.
     */
    public List<T> items() {
        return registry.items();
    }

    /**
     * @return The live tiles ordered row-major by origin.
     */
    public List<Tile> tiles() {
        return grid.tiles();
    }

    public TileGrid getGrid() {
        return grid;
    }

    public GridProperties getProperties() {
        return properties;
    }

    // ========================================================================
    // Display Values
    // ========================================================================

    public int rowMinimumHeight() {
        return properties.getVerticalSpan();
    }

    public int columnMinimumWidth() {
        return properties.getHorizontalSpan();
    }

    public int verticalSpacing() {
        return properties.getVerticalSpacing();
    }

    public int horizontalSpacing() {
        return properties.getHorizontalSpacing();
    }

    public void setVerticalSpacing(int spacing) {
        updateProperties(properties.withVerticalSpacing(spacing));
    }

    public void setHorizontalSpacing(int spacing) {
        updateProperties(properties.withHorizontalSpacing(spacing));
    }

    public void setVerticalSpan(int span) {
        updateProperties(properties.withVerticalSpan(span));
    }

    public void setHorizontalSpan(int span) {
        updateProperties(properties.withHorizontalSpan(span));
    }

    // ========================================================================
    // Interaction Policy
    // ========================================================================

    /**
     * Sets whether items may be moved by drag and drop.
     */
    public void acceptDragAndDrop(boolean value) {
        this.dragAndDrop = value;
    }

    /**
     * Sets whether tiles may be resized.
     */
    public void acceptResizing(boolean value) {
        this.resizable = value;
    }

    public boolean isDragAndDropAccepted() {
        return dragAndDrop;
    }

    public boolean isResizingAccepted() {
        return resizable;
    }

    /**
     * Remembers the item the input layer is currently dragging.
     */
    public void setItemToDrop(T item) {
        this.itemToDrop = item;
    }

    /**
     * Returns the item being dragged and forgets it.
     */
    public Optional<T> takeItemToDrop() {
        T item = itemToDrop;
        itemToDrop = null;
        return Optional.ofNullable(item);
    }

    public void addListener(ITileLayoutListener<T> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ITileLayoutListener<T> listener) {
        listeners.remove(listener);
    }

    // ========================================================================
    // Internals
    // ========================================================================

    /**
     * Merges a validated, unfilled area into one filled tile bound to the item.
     */
    private Tile occupy(T item, TileBounds area) {
        splitCompoundTiles(area);
        Tile tile = grid.ownerOf(area.row(), area.column());
        if (area.area() > 1) {
            List<Cell> cells = area.cells();
            grid.mergeInto(tile, area, cells.subList(1, cells.size()));
        }
        tile.setFilled(true);
        registry.bind(item, tile);
        return tile;
    }

    /**
     * Returns unfilled compound tiles intersecting the area to unit tiles.
     * Such tiles only exist after an empty tile was resized.
     */
    private void splitCompoundTiles(TileBounds area) {
        Set<Cell> cells = new LinkedHashSet<>();
        for (Cell cell : area.cells()) {
            Tile owner = grid.ownerOf(cell);
            if (!owner.isUnit()) {
                cells.addAll(owner.getBounds().cells());
            }
        }
        if (!cells.isEmpty()) {
            grid.splitOut(cells);
        }
    }

    private Tile requireTile(T item) throws UnknownItemException {
        int tileId = registry.tileOf(item);
        if (tileId < 0) {
            throw new UnknownItemException(item);
        }
        return grid.getTile(tileId);
    }

    private void requireInside(TileBounds area) {
        if (!properties.isInside(area.row(), area.column(), area.rowSpan(), area.columnSpan())) {
            throw new CellOutOfBoundsException("Rectangle " + area + " exceeds the "
                + rowCount() + "x" + columnCount() + " grid");
        }
    }

    private void updateProperties(GridProperties updated) {
        this.properties = updated;
        for (ITileLayoutListener<T> listener : List.copyOf(listeners)) {
            listener.onGeometryChanged(updated);
        }
    }
}

package org.tessera.runtime.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntIterator;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The cell-to-tile index of a layout.
 * <p>
 * Every cell stores the id of the tile covering it in a flat, row-major owner
 * grid. The grid is always an exact partition: each cell belongs to exactly one
 * live tile, live tiles are disjoint, and together they cover every cell.
 * <p>
 * {@link #mergeInto} and {@link #splitOut} are the only structural mutators.
 * Both validate their input completely before touching the owner grid.
 * <p>
 * Not thread-safe; callers serialize access.
 */
public class TileGrid {

    private static final Logger LOG = LoggerFactory.getLogger(TileGrid.class);

    private final GridProperties properties;
    private final int rowCount;
    private final int columnCount;
    private final int[] ownerGrid;
    private final Int2ObjectMap<Tile> tilesById = new Int2ObjectOpenHashMap<>();
    private int nextTileId = 1;

    /**
     * Creates a grid with one unfilled unit tile per cell.
     *
     * @param properties The grid properties; only the dimensions are used here.
     */
    public TileGrid(GridProperties properties) {
        this.properties = properties;
        this.rowCount = properties.getRowCount();
        this.columnCount = properties.getColumnCount();
        this.ownerGrid = new int[properties.getCellCount()];
        for (int row = 0; row < rowCount; row++) {
            for (int column = 0; column < columnCount; column++) {
                ownerGrid[row * columnCount + column] = createUnitTile(row, column).getId();
            }
        }
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columnCount;
    }

    public GridProperties getProperties() {
        return properties;
    }

    /**
     * Gets the tile covering a cell.
     *
     * @throws CellOutOfBoundsException if the cell lies outside the grid.
     */
    public Tile ownerOf(int row, int column) {
        return tilesById.get(ownerGrid[getFlatIndex(row, column)]);
    }

    public Tile ownerOf(Cell cell) {
        return ownerOf(cell.row(), cell.column());
    }

    /**
     * Checks whether the tile covering a cell is filled.
     *
     * @throws CellOutOfBoundsException if the cell lies outside the grid.
     */
    public boolean isFilled(int row, int column) {
        return ownerOf(row, column).isFilled();
    }

    /**
     * Looks up a live tile by id.
     *
     * @param tileId The tile id.
     * @return The tile, or {@code null} if no cell refers to that id any more.
     */
    public Tile getTile(int tileId) {
        return tilesById.get(tileId);
    }

    public boolean isLive(Tile tile) {
        return tile != null && tilesById.get(tile.getId()) == tile;
    }

    /**
     * @return The number of live tiles.
     */
    public int tileCount() {
        return tilesById.size();
    }

    /**
     * Lists the live tiles ordered row-major by their origin cell.
     *
     * @return A new list of live tiles.
     */
    public List<Tile> tiles() {
        List<Tile> tiles = new ArrayList<>(tilesById.size());
        for (int row = 0; row < rowCount; row++) {
            for (int column = 0; column < columnCount; column++) {
                Tile tile = tilesById.get(ownerGrid[row * columnCount + column]);
                if (tile.getRow() == row && tile.getColumn() == column) {
                    tiles.add(tile);
                }
            }
        }
        return tiles;
    }

    /**
     * Reassigns cells to an anchor tile and gives the anchor its new geometry.
     * <p>
     * After the call, every cell of {@code newBounds} refers to {@code anchor}.
     * Tiles whose cells were all absorbed are discarded.
     *
     * @param anchor        The live tile that survives the merge.
     * @param newBounds     The anchor's geometry after the merge.
     * @param cellsToAbsorb The cells of {@code newBounds} not yet owned by the anchor.
     * @throws IllegalArgumentException if the anchor is not live, an absorbed cell lies outside
     *                                  {@code newBounds} or belongs to a filled tile, or a cell of
     *                                  {@code newBounds} is neither the anchor's nor listed.
     */
    public void mergeInto(Tile anchor, TileBounds newBounds, Collection<Cell> cellsToAbsorb) {
        requireLive(anchor);
        requireInside(newBounds);
        Set<Cell> absorbed = new HashSet<>(cellsToAbsorb);
        for (Cell cell : absorbed) {
            if (!newBounds.contains(cell.row(), cell.column())) {
                throw new IllegalArgumentException("Cell " + cell + " lies outside merge target " + newBounds);
            }
            Tile owner = ownerOf(cell);
            if (owner == anchor) {
                continue;
            }
            if (owner.isFilled()) {
                throw new IllegalArgumentException("Cell " + cell + " belongs to filled " + owner);
            }
            if (!owner.isUnit() && !absorbed.containsAll(owner.getBounds().cells())) {
                throw new IllegalArgumentException("Merge would absorb only part of " + owner);
            }
        }
        for (Cell cell : newBounds.cells()) {
            if (ownerOf(cell) != anchor && !absorbed.contains(cell)) {
                throw new IllegalArgumentException("Cell " + cell + " of " + newBounds + " is neither owned nor absorbed");
            }
        }

        IntSet replaced = new IntOpenHashSet();
        for (Cell cell : absorbed) {
            int index = getFlatIndex(cell.row(), cell.column());
            if (ownerGrid[index] != anchor.getId()) {
                replaced.add(ownerGrid[index]);
                ownerGrid[index] = anchor.getId();
            }
        }
        anchor.updateSize(newBounds);
        discardOrphans(replaced);
        LOG.debug("Merged {} cells into tile #{} -> {}", absorbed.size(), anchor.getId(), newBounds);
    }

    /**
     * Gives each listed cell a fresh unfilled unit tile.
     * <p>
     * Tiles left without any cell are discarded. A tile keeping some of its
     * cells stays live with its old geometry; the caller must shrink it with
     * {@link #updateBounds} to restore the partition.
     *
     * @param cells The cells to split off.
     * @throws CellOutOfBoundsException if a cell lies outside the grid.
     */
    public void splitOut(Collection<Cell> cells) {
        for (Cell cell : cells) {
            getFlatIndex(cell.row(), cell.column());
        }
        IntSet replaced = new IntOpenHashSet();
        for (Cell cell : new HashSet<>(cells)) {
            int index = getFlatIndex(cell.row(), cell.column());
            replaced.add(ownerGrid[index]);
            ownerGrid[index] = createUnitTile(cell.row(), cell.column()).getId();
        }
        discardOrphans(replaced);
        LOG.debug("Split {} cells into unit tiles", cells.size());
    }

    /**
     * Updates the geometry of a tile whose surplus cells were already split off.
     *
     * @param tile   The live tile to update.
     * @param bounds The new geometry; every cell in it must already refer to {@code tile}.
     * @throws IllegalArgumentException if a cell of {@code bounds} belongs to another tile.
     */
    public void updateBounds(Tile tile, TileBounds bounds) {
        requireLive(tile);
        requireInside(bounds);
        for (Cell cell : bounds.cells()) {
            if (ownerOf(cell) != tile) {
                throw new IllegalArgumentException("Cell " + cell + " of " + bounds + " is not owned by " + tile);
            }
        }
        tile.updateSize(bounds);
    }

    /**
     * Checks the partition invariant over the whole grid.
     *
     * @throws IllegalStateException if a cell refers to a tile that does not cover it, a tile
     *                               does not own every cell of its rectangle, or a tile is not
     *                               referenced by any cell.
     */
    public void verifyPartition() {
        IntSet referenced = new IntOpenHashSet();
        for (int row = 0; row < rowCount; row++) {
            for (int column = 0; column < columnCount; column++) {
                int tileId = ownerGrid[row * columnCount + column];
                Tile tile = tilesById.get(tileId);
                if (tile == null) {
                    throw new IllegalStateException("Cell (" + row + ", " + column + ") refers to dead tile #" + tileId);
                }
                if (!tile.getBounds().contains(row, column)) {
                    throw new IllegalStateException("Cell (" + row + ", " + column + ") lies outside its " + tile);
                }
                referenced.add(tileId);
            }
        }
        for (Tile tile : tilesById.values()) {
            if (!referenced.contains(tile.getId())) {
                throw new IllegalStateException("Tile " + tile + " is not referenced by any cell");
            }
            requireInside(tile.getBounds());
            for (Cell cell : tile.getBounds().cells()) {
                if (ownerGrid[cell.row() * columnCount + cell.column()] != tile.getId()) {
                    throw new IllegalStateException("Cell " + cell + " is covered by " + tile + " but owned elsewhere");
                }
            }
        }
    }

    private Tile createUnitTile(int row, int column) {
        Tile tile = new Tile(nextTileId++, row, column, 1, 1);
        tilesById.put(tile.getId(), tile);
        return tile;
    }

    private void discardOrphans(IntSet candidates) {
        for (IntIterator it = candidates.iterator(); it.hasNext(); ) {
            int tileId = it.nextInt();
            Tile tile = tilesById.get(tileId);
            if (tile != null && !isReferenced(tile)) {
                tilesById.remove(tileId);
            }
        }
    }

    private boolean isReferenced(Tile tile) {
        TileBounds bounds = tile.getBounds();
        for (int row = bounds.row(); row < bounds.endRow(); row++) {
            for (int column = bounds.column(); column < bounds.endColumn(); column++) {
                if (ownerGrid[row * columnCount + column] == tile.getId()) {
                    return true;
                }
            }
        }
        return false;
    }

    private void requireLive(Tile tile) {
        if (!isLive(tile)) {
            throw new IllegalArgumentException("Tile is not part of this grid: " + tile);
        }
    }

    private void requireInside(TileBounds bounds) {
        if (!properties.isInside(bounds.row(), bounds.column(), bounds.rowSpan(), bounds.columnSpan())) {
            throw new CellOutOfBoundsException("Rectangle " + bounds + " exceeds the "
                + rowCount + "x" + columnCount + " grid");
        }
    }

    private int getFlatIndex(int row, int column) {
        if (!properties.isInside(row, column)) {
            throw new CellOutOfBoundsException(row, column, rowCount, columnCount);
        }
        return row * columnCount + column;
    }
}

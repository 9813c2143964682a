package org.tessera.runtime.internal.services;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tessera.runtime.model.Cell;
import org.tessera.runtime.model.Direction;
import org.tessera.runtime.model.Tile;
import org.tessera.runtime.model.TileBounds;
import org.tessera.runtime.model.TileGrid;

/**
 * Resolves directional grow and shrink requests against a {@link TileGrid}.
 * <p>
 * A request moves one edge of a tile by a number of units: positive units move
 * the edge outward, negative units move it inward. Growth is clamped to the grid
 * boundary and stops before the first strip that contains a cell of a filled or
 * compound tile. Shrink is clamped so the tile keeps a span of at least 1 and sheds
 * the strips next to the moving edge. Clamping is never an error; it only lowers
 * the granted amount, possibly to zero.
 * <p>
 * Resolution scans only. The grid is mutated in {@link #apply(ResizePlan)}.
 */
public final class ResizeResolver {

    private static final Logger LOG = LoggerFactory.getLogger(ResizeResolver.class);

    private final TileGrid grid;

    public ResizeResolver(TileGrid grid) {
        this.grid = grid;
    }

    /**
     * Computes what a resize request would change without mutating the grid.
     *
     * @param tile      A live tile of the grid.
     * @param direction The edge to move.
     * @param units     The outward movement; negative values shrink.
     * @return The resolved plan; a no-op plan if nothing can be granted.
     * @throws IllegalArgumentException if the tile is not live in this grid.
     */
    public ResizePlan resolve(Tile tile, Direction direction, int units) {
        if (!grid.isLive(tile)) {
            throw new IllegalArgumentException("Tile is not part of this grid: " + tile);
        }
        if (units > 0) {
            return resolveGrowth(tile, direction, units);
        }
        if (units < 0) {
            return resolveShrink(tile, direction, units);
        }
        return new ResizePlan(tile, direction, 0, 0, tile.getBounds(), List.of());
    }

    /**
     * Applies a previously resolved plan.
     *
     * @param plan A plan resolved against the current grid state.
     */
    public void apply(ResizePlan plan) {
        if (plan.isGrowth()) {
            grid.mergeInto(plan.tile(), plan.resultingBounds(), plan.affectedCells());
        } else if (plan.isShrink()) {
            grid.splitOut(plan.affectedCells());
            grid.updateBounds(plan.tile(), plan.resultingBounds());
        }
    }

    /**
     * Resolves and applies a resize request.
     *
     * @return The applied plan.
     */
    public ResizePlan resize(Tile tile, Direction direction, int units) {
        ResizePlan plan = resolve(tile, direction, units);
        if (plan.isNoOp()) {
            LOG.debug("Resize of tile #{} {} by {} granted nothing", tile.getId(), direction, units);
            return plan;
        }
        apply(plan);
        LOG.debug("Resized tile #{} {} by {} of {} requested -> {}",
            tile.getId(), direction, plan.grantedUnits(), units, plan.resultingBounds());
        return plan;
    }

    private ResizePlan resolveGrowth(Tile tile, Direction direction, int units) {
        TileBounds bounds = tile.getBounds();
        int clamped = Math.min(units, roomBeyond(bounds, direction));
        List<Cell> absorbed = new ArrayList<>();
        int granted = 0;
        for (int step = 0; step < clamped; step++) {
            List<Cell> strip = lineCells(bounds, direction, outerLine(bounds, direction, step));
            if (!isFree(strip)) {
                break;
            }
            absorbed.addAll(strip);
            granted++;
        }
        return new ResizePlan(tile, direction, units, granted, moveEdge(bounds, direction, granted), absorbed);
    }

    private ResizePlan resolveShrink(Tile tile, Direction direction, int units) {
        TileBounds bounds = tile.getBounds();
        int span = direction.isVertical() ? bounds.rowSpan() : bounds.columnSpan();
        int shed = (int) Math.min(-(long) units, span - 1);
        List<Cell> released = new ArrayList<>();
        for (int step = 0; step < shed; step++) {
            released.addAll(lineCells(bounds, direction, innerLine(bounds, direction, step)));
        }
        return new ResizePlan(tile, direction, units, -shed, moveEdge(bounds, direction, -shed), released);
    }

    /**
     * Number of rows or columns between the moving edge and the grid boundary.
     */
    private int roomBeyond(TileBounds bounds, Direction direction) {
        return switch (direction) {
            case NORTH -> bounds.row();
            case SOUTH -> grid.getRowCount() - bounds.endRow();
            case WEST -> bounds.column();
            case EAST -> grid.getColumnCount() - bounds.endColumn();
        };
    }

    /**
     * Index of the row or column {@code step} strips beyond the moving edge.
     */
    private static int outerLine(TileBounds bounds, Direction direction, int step) {
        return switch (direction) {
            case NORTH -> bounds.row() - 1 - step;
            case SOUTH -> bounds.endRow() + step;
            case WEST -> bounds.column() - 1 - step;
            case EAST -> bounds.endColumn() + step;
        };
    }

    /**
     * Index of the row or column {@code step} strips inside the moving edge.
     */
    private static int innerLine(TileBounds bounds, Direction direction, int step) {
        return switch (direction) {
            case NORTH -> bounds.row() + step;
            case SOUTH -> bounds.endRow() - 1 - step;
            case WEST -> bounds.column() + step;
            case EAST -> bounds.endColumn() - 1 - step;
        };
    }

    /**
     * Cells of one full row (north/south) or column (east/west) across the tile's extent.
     */
    private static List<Cell> lineCells(TileBounds bounds, Direction direction, int line) {
        List<Cell> cells = new ArrayList<>();
        if (direction.isVertical()) {
            for (int column = bounds.column(); column < bounds.endColumn(); column++) {
                cells.add(new Cell(line, column));
            }
        } else {
            for (int row = bounds.row(); row < bounds.endRow(); row++) {
                cells.add(new Cell(row, line));
            }
        }
        return cells;
    }

    /**
     * A strip can be absorbed only if each of its cells is an unfilled unit tile.
     */
    private boolean isFree(List<Cell> strip) {
        for (Cell cell : strip) {
            Tile owner = grid.ownerOf(cell);
            if (owner.isFilled() || !owner.isUnit()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Moves the given edge outward by {@code delta} units (inward when negative).
     */
    private static TileBounds moveEdge(TileBounds bounds, Direction direction, int delta) {
        int rows = direction.isVertical() ? delta : 0;
        int columns = direction.isVertical() ? 0 : delta;
        int row = bounds.row();
        int column = bounds.column();
        if (direction.isTowardOrigin()) {
            row -= rows;
            column -= columns;
        }
        return new TileBounds(row, column, bounds.rowSpan() + rows, bounds.columnSpan() + columns);
    }
}

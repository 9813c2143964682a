package org.tessera.runtime.internal.services;

import java.util.List;

import org.tessera.runtime.model.Cell;
import org.tessera.runtime.model.Direction;
import org.tessera.runtime.model.Tile;
import org.tessera.runtime.model.TileBounds;

/**
 * The outcome of resolving a resize request, computed before anything is mutated.
 *
 * @param tile            The tile being resized.
 * @param direction       The edge that moves.
 * @param requestedUnits  The requested outward movement; negative for shrink.
 * @param grantedUnits    The movement that can actually be applied, same sign as requested or 0.
 * @param resultingBounds The tile's geometry once the plan is applied.
 * @param affectedCells   The cells absorbed (growth) or shed (shrink), strip by strip from the edge outward.
 */
public record ResizePlan(Tile tile, Direction direction, int requestedUnits, int grantedUnits,
                         TileBounds resultingBounds, List<Cell> affectedCells) {

    public ResizePlan {
        affectedCells = List.copyOf(affectedCells);
    }

    public boolean isNoOp() {
        return grantedUnits == 0;
    }

    public boolean isGrowth() {
        return grantedUnits > 0;
    }

    public boolean isShrink() {
        return grantedUnits < 0;
    }

    /**
     * @return {@code true} if collisions or the grid boundary cut the request short.
     */
    public boolean isClamped() {
        return grantedUnits != requestedUnits;
    }
}

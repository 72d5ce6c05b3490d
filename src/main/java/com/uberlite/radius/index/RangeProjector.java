package com.uberlite.radius.index;

import com.uberlite.radius.grid.HexGrid;

/**
 * Maps a cell to the band of compact values held by all of its
 * resolution-15 descendants.
 *
 * H3 fills the digits below a cell's own resolution with 7 (binary 111), so the
 * cell's compact value is the largest value any descendant can take. Clearing
 * those digits gives the smallest. Child digits only range over 0..6, so every
 * descendant falls inside the band.
 */
public class RangeProjector {

    private final HexGrid grid;

    public RangeProjector(HexGrid grid) {
        this.grid = grid;
    }

    public CompactRange project(long cell) {
        int diffLevels = HexGrid.FINEST_RESOLUTION - grid.resolution(cell);
        if (diffLevels < 0) {
            throw new IllegalStateException(
                "Cell " + Long.toHexString(cell) + " is finer than resolution " + HexGrid.FINEST_RESOLUTION);
        }

        int bits = diffLevels * CompactIndex.BITS_PER_LEVEL;
        long rangeSize = (1L << bits) - 1;
        long upperBound = CompactIndex.toCompact(cell);
        if (Long.compareUnsigned(rangeSize, upperBound) > 0) {
            throw new IllegalStateException(
                "Range of " + rangeSize + " values underflows compact index " + upperBound
                    + " of cell " + Long.toHexString(cell));
        }

        return new CompactRange(upperBound - rangeSize, upperBound);
    }
}

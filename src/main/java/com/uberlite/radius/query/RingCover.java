package com.uberlite.radius.query;

import java.util.Set;

/**
 * Hexagons covering a search circle.
 *
 * @param resolution resolution the ring was computed at
 * @param ringSize number of rings walked around the center cell
 * @param cells H3 cell ids, center included
 */
public record RingCover(
    int resolution,
    int ringSize,
    Set<Long> cells
) {
    public RingCover {
        cells = Set.copyOf(cells);
    }
}

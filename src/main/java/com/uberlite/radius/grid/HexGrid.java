package com.uberlite.radius.grid;

import java.util.Set;

/**
 * Hierarchical hexagonal grid operations consumed by the radius search.
 *
 * Cells are 64-bit ids in the H3 layout: resolution in bits 52-55, base cell in
 * bits 45-51, then one 3-bit child digit per resolution 1..15 with unused finer
 * digits set to 7.
 *
 * Implementations must be safe for concurrent read-only use.
 */
public interface HexGrid {

    int FINEST_RESOLUTION = 15;

    long cellOf(double lat, double lon, int resolution);

    /** Center cell plus every cell within {@code k} grid steps. */
    Set<Long> kRing(long cell, int k);

    /** Approximate distance from the cell center to its boundary, in meters. */
    double approxRadiusMeters(long cell);

    int resolution(long cell);
}

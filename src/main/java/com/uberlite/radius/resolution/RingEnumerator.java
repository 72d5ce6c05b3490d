package com.uberlite.radius.resolution;

import com.uberlite.radius.grid.GeoDistance;
import com.uberlite.radius.grid.HexGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Finds the k-ring of cells around a center cell that covers a search radius.
 */
public class RingEnumerator {
    private static final Logger log = LoggerFactory.getLogger(RingEnumerator.class);

    private final HexGrid grid;
    private final double ringMultiplier;

    public RingEnumerator(HexGrid grid, double ringMultiplier) {
        this.grid = grid;
        this.ringMultiplier = ringMultiplier;
    }

    /**
     * {@code k = floor(radius / (cellRadius * ringMultiplier)) + 1}.
     * The multiplier absorbs the mismatch between a hex ring and a circle.
     * Capped once the rings would reach the antipode, since every further ring
     * adds no new cells.
     */
    public int ringSize(long center, double radiusMeters) {
        double cellRadius = grid.approxRadiusMeters(center);
        double rings = Math.floor(radiusMeters / (cellRadius * ringMultiplier));
        return (int) Math.min(rings, maxUsefulRings(cellRadius)) + 1;
    }

    /** Neighbour centers are at least one cell radius apart. */
    static double maxUsefulRings(double cellRadiusMeters) {
        return Math.ceil(Math.PI * GeoDistance.EARTH_RADIUS_METERS / cellRadiusMeters);
    }

    public Set<Long> enumerate(long center, double radiusMeters) {
        return ring(center, ringSize(center, radiusMeters));
    }

    /** Always contains {@code center}, including for {@code k == 0}. */
    public Set<Long> ring(long center, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Ring size must be non-negative, got: " + k);
        }
        Set<Long> ring = grid.kRing(center, k);
        if (!ring.contains(center)) {
            ring = new LinkedHashSet<>(ring);
            ring.add(center);
        }
        log.debug("k={} ring around {} has {} cells", k, Long.toHexString(center), ring.size());
        return ring;
    }
}

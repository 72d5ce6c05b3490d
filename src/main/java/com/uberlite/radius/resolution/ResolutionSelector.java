package com.uberlite.radius.resolution;

import com.uberlite.radius.config.RadiusSearchConfigurationException;

/**
 * Picks the finest table resolution whose edge, scaled by the edge multiplier,
 * still exceeds the search radius.
 *
 * Finer resolutions give tighter ranges but need more rings to cover the
 * radius; the multiplier bounds the ring count.
 */
public class ResolutionSelector {

    private final EdgeLengthTable table;
    private final double edgeMultiplier;

    public ResolutionSelector(EdgeLengthTable table, double edgeMultiplier) {
        this.table = table;
        this.edgeMultiplier = edgeMultiplier;
    }

    public int selectResolution(double radiusMeters) {
        if (radiusMeters < 0 || !Double.isFinite(radiusMeters)) {
            throw new IllegalArgumentException(
                "Radius must be non-negative and finite, got: " + radiusMeters);
        }
        for (EdgeLengthTable.Entry entry : table.entries()) {
            if (entry.isSentinel() || entry.edgeLengthMeters() * edgeMultiplier > radiusMeters) {
                return entry.resolution();
            }
        }
        throw new RadiusSearchConfigurationException(
            "No edge length table entry resolves a radius of " + radiusMeters + " m");
    }
}

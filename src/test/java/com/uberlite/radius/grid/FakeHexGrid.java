package com.uberlite.radius.grid;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic grid for arithmetic tests. Builds ids in the H3 bit layout
 * without touching the native library.
 */
public class FakeHexGrid implements HexGrid {

    private static final long CELL_MODE = 1L << 59;

    private final Map<Long, Set<Long>> rings = new HashMap<>();
    private final Map<Long, Double> radii = new HashMap<>();
    private final Map<Long, Integer> resolutionOverrides = new HashMap<>();
    private double defaultRadiusMeters = 100.0;
    private long cellForAnyPoint;

    /** Cell id with the given base cell and one child digit per resolution level. */
    public static long cell(int baseCell, int... digits) {
        int resolution = digits.length;
        long id = CELL_MODE | ((long) resolution << 52) | ((long) baseCell << 45);
        for (int level = 1; level <= 15; level++) {
            long digit = level <= resolution ? digits[level - 1] : 7;
            id |= digit << ((15 - level) * 3);
        }
        return id;
    }

    public FakeHexGrid withRing(long center, int k, Set<Long> cells) {
        rings.put(center * 31 + k, cells);
        return this;
    }

    public FakeHexGrid withRadius(long cell, double meters) {
        radii.put(cell, meters);
        return this;
    }

    public FakeHexGrid withDefaultRadius(double meters) {
        this.defaultRadiusMeters = meters;
        return this;
    }

    public FakeHexGrid withResolution(long cell, int resolution) {
        resolutionOverrides.put(cell, resolution);
        return this;
    }

    public FakeHexGrid withCellForAnyPoint(long cell) {
        this.cellForAnyPoint = cell;
        return this;
    }

    @Override
    public long cellOf(double lat, double lon, int resolution) {
        return cellForAnyPoint;
    }

    @Override
    public Set<Long> kRing(long cell, int k) {
        Set<Long> ring = rings.get(cell * 31 + k);
        if (ring != null) {
            return new LinkedHashSet<>(ring);
        }
        return new LinkedHashSet<>(Set.of(cell));
    }

    @Override
    public double approxRadiusMeters(long cell) {
        return radii.getOrDefault(cell, defaultRadiusMeters);
    }

    @Override
    public int resolution(long cell) {
        Integer override = resolutionOverrides.get(cell);
        if (override != null) {
            return override;
        }
        return (int) ((cell >>> 52) & 0xF);
    }
}

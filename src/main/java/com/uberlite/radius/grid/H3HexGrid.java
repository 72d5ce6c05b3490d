package com.uberlite.radius.grid;

import com.uber.h3core.H3Core;
import com.uber.h3core.util.LatLng;

import java.io.IOException;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@link HexGrid} backed by Uber's H3 library.
 *
 * H3Core is thread-safe after initialization, so a single instance is shared
 * across the JVM. Invalid coordinates or cell ids surface as H3's own exceptions.
 */
public final class H3HexGrid implements HexGrid {

    private static final H3Core H3;

    static {
        try {
            H3 = H3Core.newInstance();
        } catch (IOException e) {
            throw new ExceptionInInitializerError(
                "Failed to load H3 native library: " + e.getMessage());
        }
    }

    private static final H3HexGrid INSTANCE = new H3HexGrid();

    private H3HexGrid() {}

    public static H3HexGrid instance() {
        return INSTANCE;
    }

    @Override
    public long cellOf(double lat, double lon, int resolution) {
        return H3.latLngToCell(lat, lon, resolution);
    }

    @Override
    public Set<Long> kRing(long cell, int k) {
        return new LinkedHashSet<>(H3.gridDisk(cell, k));
    }

    /**
     * Distance from the cell center to its first boundary vertex.
     * Hexagons are close enough to regular that any vertex gives the circumradius.
     */
    @Override
    public double approxRadiusMeters(long cell) {
        LatLng center = H3.cellToLatLng(cell);
        LatLng vertex = H3.cellToBoundary(cell).get(0);
        return GeoDistance.meters(center.lat, center.lng, vertex.lat, vertex.lng);
    }

    @Override
    public int resolution(long cell) {
        return H3.getResolution(cell);
    }
}

package com.uberlite.radius.config;

import java.util.Map;

/**
 * Tuning parameters for radius search.
 *
 * @param edgeMultiplier a resolution is usable once {@code edgeLength * edgeMultiplier} exceeds the radius
 * @param ringMultiplier scales the cell radius when deriving how many rings cover the search radius
 * @param indexResolution resolution entities are indexed at by the store
 */
public record RadiusSearchConfig(
    double edgeMultiplier,
    double ringMultiplier,
    int indexResolution
) {
    public static final String EDGE_MULTIPLIER_ENV = "RADIUS_EDGE_MULTIPLIER";
    public static final String RING_MULTIPLIER_ENV = "RADIUS_RING_MULTIPLIER";
    public static final String INDEX_RESOLUTION_ENV = "RADIUS_INDEX_RESOLUTION";

    public static final double DEFAULT_EDGE_MULTIPLIER = 3.0;
    public static final double DEFAULT_RING_MULTIPLIER = 2.5;
    public static final int DEFAULT_INDEX_RESOLUTION = 15;

    public RadiusSearchConfig {
        if (!(edgeMultiplier > 0) || Double.isInfinite(edgeMultiplier)) {
            throw new RadiusSearchConfigurationException(
                "Edge multiplier must be positive and finite, got: " + edgeMultiplier);
        }
        if (!(ringMultiplier > 0) || Double.isInfinite(ringMultiplier)) {
            throw new RadiusSearchConfigurationException(
                "Ring multiplier must be positive and finite, got: " + ringMultiplier);
        }
        if (indexResolution < 0 || indexResolution > 15) {
            throw new RadiusSearchConfigurationException(
                "Index resolution must be 0-15, got: " + indexResolution);
        }
    }

    public static RadiusSearchConfig defaults() {
        return new RadiusSearchConfig(DEFAULT_EDGE_MULTIPLIER, DEFAULT_RING_MULTIPLIER, DEFAULT_INDEX_RESOLUTION);
    }

    public static RadiusSearchConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    public static RadiusSearchConfig fromMap(Map<String, String> env) {
        double edge = parseDouble(env, EDGE_MULTIPLIER_ENV, DEFAULT_EDGE_MULTIPLIER);
        double ring = parseDouble(env, RING_MULTIPLIER_ENV, DEFAULT_RING_MULTIPLIER);
        int resolution = parseInt(env, INDEX_RESOLUTION_ENV, DEFAULT_INDEX_RESOLUTION);
        return new RadiusSearchConfig(edge, ring, resolution);
    }

    private static double parseDouble(Map<String, String> env, String key, double fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new RadiusSearchConfigurationException(key + " is not a number: " + raw, e);
        }
    }

    private static int parseInt(Map<String, String> env, String key, int fallback) {
        String raw = env.get(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new RadiusSearchConfigurationException(key + " is not an integer: " + raw, e);
        }
    }
}

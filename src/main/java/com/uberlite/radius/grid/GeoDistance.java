package com.uberlite.radius.grid;

/**
 * Great-circle distance on a spherical Earth.
 */
public final class GeoDistance {

    public static final double EARTH_RADIUS_METERS = 6_371_008.8;

    private GeoDistance() {}

    /** Haversine distance between two coordinates in degrees, in meters. */
    public static double meters(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }
}

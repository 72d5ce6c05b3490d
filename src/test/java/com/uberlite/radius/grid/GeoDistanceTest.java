package com.uberlite.radius.grid;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GeoDistanceTest {

    @Test
    void samePointIsZero() {
        assertEquals(0.0, GeoDistance.meters(37.7749, -122.4194, 37.7749, -122.4194), 1e-9);
    }

    @Test
    void oneDegreeOfLatitudeIsAbout111Km() {
        double meters = GeoDistance.meters(0, 0, 1, 0);
        assertEquals(111_195, meters, 50);
    }

    @Test
    void isSymmetric() {
        double ab = GeoDistance.meters(40.7128, -74.0060, 51.5074, -0.1278);
        double ba = GeoDistance.meters(51.5074, -0.1278, 40.7128, -74.0060);
        assertEquals(ab, ba, 1e-6);
        assertEquals(5_570_000, ab, 10_000);
    }
}

package com.presencelite.geo;

import com.presencelite.model.GeoPoint;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GeoMathTest {

    @Test
    void haversine_zeroForSamePoint() {
        assertEquals(0.0, GeoMath.haversineMeters(37.7749, -122.4194, 37.7749, -122.4194), 1e-9);
    }

    @Test
    void haversine_sanFranciscoToLosAngeles() {
        double meters = GeoMath.haversineMeters(37.7749, -122.4194, 34.0522, -118.2437);
        assertEquals(559_000, meters, 2_000);
    }

    @Test
    void offsetNorth_placesPointAtRequestedDistance() {
        var origin = new GeoPoint(51.5, -0.12);
        for (double meters : new double[]{10, 49, 500, 5_000, 40_000}) {
            assertEquals(meters, GeoMath.haversineMeters(origin, GeoMath.offsetNorth(origin, meters)), 1e-6);
        }
    }
}

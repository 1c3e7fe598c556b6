package com.presencelite.model;

/**
 * Bounding box of a geohash cell, in degrees.
 */
public record GeoBounds(double minLat, double maxLat, double minLng, double maxLng) {

    public GeoPoint center() {
        return new GeoPoint((minLat + maxLat) / 2, (minLng + maxLng) / 2);
    }

    public boolean contains(double lat, double lng) {
        return lat >= minLat && lat <= maxLat && lng >= minLng && lng <= maxLng;
    }
}

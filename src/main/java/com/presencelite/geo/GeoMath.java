package com.presencelite.geo;

import com.presencelite.model.GeoPoint;

public final class GeoMath {

    public static final double EARTH_RADIUS_METERS = 6_371_000;

    private GeoMath() {
    }

    /**
     * Great-circle distance in metres.
     */
    public static double haversineMeters(double lat1, double lng1, double lat2, double lng2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLng = Math.toRadians(lng2 - lng1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
            + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
            * Math.sin(dLng / 2) * Math.sin(dLng / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return EARTH_RADIUS_METERS * c;
    }

    public static double haversineMeters(GeoPoint from, GeoPoint to) {
        return haversineMeters(from.latitude(), from.longitude(), to.latitude(), to.longitude());
    }

    /**
     * Point reached by travelling {@code meters} due north; used to place
     * points at exact distances.
     */
    public static GeoPoint offsetNorth(GeoPoint origin, double meters) {
        double dLat = Math.toDegrees(meters / EARTH_RADIUS_METERS);
        return new GeoPoint(origin.latitude() + dLat, origin.longitude());
    }
}

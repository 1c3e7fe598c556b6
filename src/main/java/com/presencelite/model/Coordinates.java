package com.presencelite.model;

/**
 * Raw device coordinates. Only ever held for the local user.
 *
 * @param latitude  degrees, [-90, 90]
 * @param longitude degrees, [-180, 180]
 * @param altitude  metres, may be null
 * @param accuracy  metres, may be null
 * @param heading   degrees clockwise from north, may be null
 * @param speed     m/s, may be null
 */
public record Coordinates(
    double latitude,
    double longitude,
    Double altitude,
    Double accuracy,
    Double heading,
    Double speed
) {
    public Coordinates {
        // Written so NaN fails too
        if (!(latitude >= -90 && latitude <= 90)) {
            throw new IllegalArgumentException("Latitude must be between -90 and 90, got " + latitude);
        }
        if (!(longitude >= -180 && longitude <= 180)) {
            throw new IllegalArgumentException("Longitude must be between -180 and 180, got " + longitude);
        }
    }

    public static Coordinates of(double latitude, double longitude) {
        return new Coordinates(latitude, longitude, null, null, null, null);
    }
}

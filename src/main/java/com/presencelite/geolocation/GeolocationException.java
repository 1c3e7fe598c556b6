package com.presencelite.geolocation;

/**
 * Thrown when a watch cannot be started at all, e.g. permission was denied.
 */
public class GeolocationException extends Exception {

    private final LocationError error;

    public GeolocationException(LocationError error) {
        super(error.kind() + ": " + error.message());
        this.error = error;
    }

    public LocationError error() {
        return error;
    }
}

package com.presencelite.geolocation;

public record LocationError(LocationErrorKind kind, String message) {

    public static LocationError permissionDenied(String message) {
        return new LocationError(LocationErrorKind.PERMISSION_DENIED, message);
    }

    public static LocationError unavailable(String message) {
        return new LocationError(LocationErrorKind.POSITION_UNAVAILABLE, message);
    }
}

package com.presencelite.geolocation;

import com.presencelite.model.Coordinates;
import com.presencelite.model.LocationSource;

/**
 * One position sample from a {@link GeolocationSource}.
 */
public record GeoFix(Coordinates coordinates, LocationSource source, long timestamp) {
}

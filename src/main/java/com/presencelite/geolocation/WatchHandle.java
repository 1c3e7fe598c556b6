package com.presencelite.geolocation;

/**
 * Token returned by {@link GeolocationSource#watch}; pass it back to
 * {@link GeolocationSource#clearWatch} to cancel.
 */
public record WatchHandle(long id) {
}

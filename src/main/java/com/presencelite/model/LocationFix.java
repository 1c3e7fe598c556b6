package com.presencelite.model;

/**
 * The local user's current location. Never serialized.
 */
public record LocationFix(
    Coordinates coordinates,
    LocationSource source,
    long timestamp,
    boolean live,
    LocationCommitment commitment
) {
    public boolean isMoving() {
        return SpeedCategory.isMoving(coordinates.speed());
    }
}

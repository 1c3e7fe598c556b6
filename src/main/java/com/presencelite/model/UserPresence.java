package com.presencelite.model;

/**
 * Presence of one participant. Immutable; updates produce a new instance.
 * For peers {@code location} is always null: peer locations are only kept as
 * the geohash cells they broadcast.
 */
public record UserPresence(
    String identity,
    String displayName,
    String color,
    LocationFix location,
    PresenceStatus status,
    String statusMessage,
    long lastSeen,
    boolean moving,
    DeviceType deviceType
) {
    public UserPresence withLocation(LocationFix location, boolean moving, long lastSeen) {
        return new UserPresence(identity, displayName, color, location, status, statusMessage, lastSeen, moving, deviceType);
    }

    public UserPresence withStatus(PresenceStatus status, String statusMessage) {
        return new UserPresence(identity, displayName, color, location, status, statusMessage, lastSeen, moving, deviceType);
    }

    public UserPresence withLastSeen(long lastSeen) {
        return new UserPresence(identity, displayName, color, location, status, statusMessage, lastSeen, moving, deviceType);
    }

    public UserPresence withMoving(boolean moving) {
        return new UserPresence(identity, displayName, color, location, status, statusMessage, lastSeen, moving, deviceType);
    }

    public UserPresence withProfile(String displayName, String color, DeviceType deviceType) {
        return new UserPresence(identity, displayName, color, location, status, statusMessage, lastSeen, moving, deviceType);
    }
}

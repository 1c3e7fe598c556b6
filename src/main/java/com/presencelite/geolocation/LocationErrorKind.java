package com.presencelite.geolocation;

public enum LocationErrorKind {
    PERMISSION_DENIED,
    POSITION_UNAVAILABLE,
    TIMEOUT;

    /** Permission problems need user action; the others may clear on their own. */
    public boolean isTransient() {
        return this != PERMISSION_DENIED;
    }
}

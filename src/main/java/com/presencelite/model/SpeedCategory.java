package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Coarse speed bucket broadcast instead of the measured speed.
 */
public enum SpeedCategory {
    @JsonProperty("stationary") STATIONARY,
    @JsonProperty("walking") WALKING,
    @JsonProperty("cycling") CYCLING,
    @JsonProperty("driving") DRIVING,
    @JsonProperty("flying") FLYING;

    /** Speed at or above which a fix counts as moving, in m/s. */
    public static final double MOVING_THRESHOLD_MPS = 0.5;

    public static SpeedCategory of(Double speedMps) {
        if (speedMps == null || speedMps < MOVING_THRESHOLD_MPS) return STATIONARY;
        if (speedMps < 2) return WALKING;
        if (speedMps < 8) return CYCLING;
        if (speedMps < 50) return DRIVING;
        return FLYING;
    }

    public static boolean isMoving(Double speedMps) {
        return speedMps != null && speedMps >= MOVING_THRESHOLD_MPS;
    }
}

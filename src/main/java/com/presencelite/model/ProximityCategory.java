package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Distance buckets, nearest first. Each bound is exclusive.
 */
public enum ProximityCategory {
    @JsonProperty("here") HERE(50),
    @JsonProperty("nearby") NEARBY(500),
    @JsonProperty("same-area") SAME_AREA(5_000),
    @JsonProperty("same-city") SAME_CITY(50_000),
    @JsonProperty("far") FAR(Double.POSITIVE_INFINITY);

    private final double upperBoundMeters;

    ProximityCategory(double upperBoundMeters) {
        this.upperBoundMeters = upperBoundMeters;
    }

    public double upperBoundMeters() {
        return upperBoundMeters;
    }

    public static ProximityCategory forDistance(double meters) {
        for (var category : values()) {
            if (meters < category.upperBoundMeters) {
                return category;
            }
        }
        return FAR;
    }

    public boolean isWithin(ProximityCategory max) {
        return compareTo(max) <= 0;
    }
}

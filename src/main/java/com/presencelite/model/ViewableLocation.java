package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A peer's location as one viewer may see it. {@code uncertaintyRadiusMeters}
 * depends on {@code precision} only, never on the sender's real accuracy.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ViewableLocation(
    String geohash,
    int precision,
    GeoPoint center,
    GeoBounds bounds,
    double uncertaintyRadiusMeters,
    double ageSeconds,
    boolean moving,
    Double heading,
    SpeedCategory speedCategory
) {
}

package com.presencelite.projection;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.presencelite.model.GeoPoint;
import com.presencelite.model.PresenceStatus;
import com.presencelite.model.TrustTier;

/**
 * Render-ready marker for one peer: a circle at the cell centre whose radius
 * is the cell's uncertainty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceIndicator(
    String id,
    String displayName,
    String color,
    GeoPoint position,
    double uncertaintyRadiusMeters,
    boolean moving,
    Double heading,
    PresenceStatus status,
    TrustTier trustTier,
    boolean verified,
    long lastSeen,
    double opacity
) {
}

package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProximityInfo(
    ProximityCategory category,
    boolean verified,
    Double approximateMeters,
    boolean mutuallyVisible
) {
    /** Proximity when there is no local fix to measure from. */
    public static ProximityInfo unknown() {
        return new ProximityInfo(ProximityCategory.FAR, false, null, false);
    }
}

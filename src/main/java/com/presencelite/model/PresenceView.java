package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * How the local user sees one peer. Derived from the peer's presence and the
 * local trust tier; never stored anywhere but the manager's view map.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceView(
    String peerIdentity,
    String displayName,
    String color,
    ViewableLocation location,
    PresenceStatus status,
    long lastSeen,
    TrustTier trustTier,
    boolean verified,
    ProximityInfo proximity
) {
}

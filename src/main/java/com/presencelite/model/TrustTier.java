package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Relationship strength a viewer holds for a peer. Declaration order is
 * disclosure order: later constants are entitled to finer location cells.
 */
public enum TrustTier {
    @JsonProperty("public") PUBLIC,
    @JsonProperty("network") NETWORK,
    @JsonProperty("friends") FRIENDS,
    @JsonProperty("close") CLOSE,
    @JsonProperty("intimate") INTIMATE;

    /**
     * Parses the lowercase wire name, e.g. {@code "friends"}.
     */
    public static TrustTier fromWireName(String name) {
        for (var tier : values()) {
            if (tier.name().equalsIgnoreCase(name)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown trust tier: " + name);
    }
}

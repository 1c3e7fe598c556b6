package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum LocationSource {
    @JsonProperty("gps") GPS,
    @JsonProperty("network") NETWORK,
    @JsonProperty("manual") MANUAL,
    @JsonProperty("beacon") BEACON,
    @JsonProperty("nfc") NFC,
    @JsonProperty("ip") IP,
    @JsonProperty("cached") CACHED;

    /** Only device-driven sources produce a continuously updating fix. */
    public boolean isLive() {
        return this == GPS || this == NETWORK || this == BEACON;
    }
}

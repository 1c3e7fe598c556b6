package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum PresenceStatus {
    @JsonProperty("online") ONLINE,
    @JsonProperty("away") AWAY,
    @JsonProperty("busy") BUSY,
    @JsonProperty("invisible") INVISIBLE,
    @JsonProperty("offline") OFFLINE;

    /** Statuses counted as "online" by the channel and the status endpoint. */
    public boolean isReachable() {
        return this == ONLINE || this == AWAY;
    }
}

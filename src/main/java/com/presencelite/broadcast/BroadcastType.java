package com.presencelite.broadcast;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum BroadcastType {
    @JsonProperty("location") LOCATION,
    @JsonProperty("status") STATUS,
    @JsonProperty("proximity") PROXIMITY,
    @JsonProperty("leave") LEAVE
}

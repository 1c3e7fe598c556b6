package com.presencelite.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DeviceType {
    @JsonProperty("mobile") MOBILE,
    @JsonProperty("desktop") DESKTOP,
    @JsonProperty("tablet") TABLET,
    @JsonProperty("unknown") UNKNOWN
}

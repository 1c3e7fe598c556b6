package com.presencelite.broadcast;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Payload of a {@link PresenceBroadcast}. {@code leave} broadcasts carry none.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
    @JsonSubTypes.Type(value = LocationPayload.class, name = "location"),
    @JsonSubTypes.Type(value = StatusPayload.class, name = "status"),
    @JsonSubTypes.Type(value = ProximityPayload.class, name = "proximity")
})
public sealed interface BroadcastPayload permits LocationPayload, StatusPayload, ProximityPayload {

    /** The envelope type this payload belongs to. */
    @JsonIgnore
    BroadcastType broadcastType();
}

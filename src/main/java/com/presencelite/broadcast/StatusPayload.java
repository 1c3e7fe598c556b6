package com.presencelite.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.presencelite.model.DeviceType;
import com.presencelite.model.PresenceStatus;

/**
 * @param sharingLocation false tells receivers to drop any location they hold
 *                        for the sender
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusPayload(
    PresenceStatus status,
    String message,
    DeviceType deviceType,
    String displayName,
    String color,
    boolean sharingLocation
) implements BroadcastPayload {

    @Override
    public BroadcastType broadcastType() {
        return BroadcastType.STATUS;
    }
}

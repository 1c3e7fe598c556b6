package com.presencelite.broadcast;

import com.presencelite.model.Commitment;
import com.presencelite.model.ProximityCategory;

/**
 * Sender's claim about its distance to {@code targetIdentity}, backed by the
 * sender's current location commitment.
 */
public record ProximityPayload(
    String targetIdentity,
    ProximityCategory category,
    Commitment proof
) implements BroadcastPayload {

    @Override
    public BroadcastType broadcastType() {
        return BroadcastType.PROXIMITY;
    }
}

package com.presencelite.engine;

import com.presencelite.broadcast.LocationPayload;
import com.presencelite.model.ProximityInfo;
import com.presencelite.model.UserPresence;

/**
 * What the manager remembers about one peer. Only the cells the peer
 * broadcast are kept, never anything finer. Guarded by the manager lock.
 */
final class PeerState {

    UserPresence presence;
    LocationPayload location;
    boolean commitmentVerified;
    /** Category the peer reported in a proximity broadcast; cleared by its next location. */
    ProximityInfo reportedProximity;
    int ttlSeconds;

    PeerState(UserPresence presence, int ttlSeconds) {
        this.presence = presence;
        this.ttlSeconds = ttlSeconds;
    }

    String identity() {
        return presence.identity();
    }

    void clearLocation() {
        location = null;
        commitmentVerified = false;
        reportedProximity = null;
    }
}

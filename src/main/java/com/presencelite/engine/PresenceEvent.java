package com.presencelite.engine;

import com.presencelite.geolocation.LocationError;
import com.presencelite.model.ConnectionState;
import com.presencelite.model.PresenceStatus;
import com.presencelite.model.ProximityInfo;
import com.presencelite.model.UserPresence;
import com.presencelite.model.ViewableLocation;

/**
 * Everything a {@link PresenceManager} tells its listeners about.
 */
public sealed interface PresenceEvent {

    /** Event name as shown to UI layers, e.g. {@code user:joined}. */
    String type();

    record UserJoined(UserPresence user) implements PresenceEvent {
        public String type() { return "user:joined"; }
    }

    record UserLeft(String identity) implements PresenceEvent {
        public String type() { return "user:left"; }
    }

    record UserUpdated(UserPresence user) implements PresenceEvent {
        public String type() { return "user:updated"; }
    }

    record LocationUpdated(String identity, ViewableLocation location) implements PresenceEvent {
        public String type() { return "location:updated"; }
    }

    record ProximityDetected(String identity, ProximityInfo proximity) implements PresenceEvent {
        public String type() { return "proximity:detected"; }
    }

    record StatusChanged(String identity, PresenceStatus status, String message) implements PresenceEvent {
        public String type() { return "status:changed"; }
    }

    record ConnectionChanged(ConnectionState previous, ConnectionState current) implements PresenceEvent {
        public String type() { return "connection:changed"; }
    }

    /**
     * @param locationError set when the failure came from the geolocation source
     */
    record ErrorOccurred(String message, LocationError locationError) implements PresenceEvent {
        public String type() { return "error"; }
    }
}

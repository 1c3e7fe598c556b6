package com.presencelite.channel;

import com.presencelite.broadcast.BroadcastCodec;
import com.presencelite.broadcast.MalformedBroadcastException;
import com.presencelite.engine.IngestResult;
import com.presencelite.engine.PresenceEventListener;
import com.presencelite.engine.PresenceManager;
import com.presencelite.engine.Subscription;
import com.presencelite.model.ConnectionState;
import com.presencelite.model.PresenceStatus;
import com.presencelite.model.PresenceView;
import com.presencelite.model.ProximityCategory;
import com.presencelite.model.TrustTier;
import com.presencelite.model.UserPresence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Binds a {@link PresenceManager} to a {@link PresenceTransport} and exposes
 * the state a UI layer renders. Incoming bytes are decoded here; anything
 * that does not decode is counted and dropped.
 */
public class PresenceChannel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PresenceChannel.class);

    private final PresenceManager manager;
    private final PresenceTransport transport;
    private final BroadcastCodec codec;
    private Subscription inbound;

    public PresenceChannel(PresenceManager manager, PresenceTransport transport, BroadcastCodec codec) {
        this.manager = manager;
        this.transport = transport;
        this.codec = codec;
    }

    /** Subscribes to the transport, then starts the manager on it. */
    public synchronized void connect() {
        if (inbound != null) {
            throw new IllegalStateException("Channel already connected");
        }
        inbound = transport.subscribe(this::receive);
        manager.start(transport);
    }

    /** Decodes and applies one incoming broadcast. Returns null when the bytes were malformed. */
    public IngestResult receive(byte[] bytes) {
        try {
            return manager.handleBroadcast(codec.decode(bytes));
        } catch (MalformedBroadcastException e) {
            manager.metrics().recordMalformed();
            log.debug("Dropped malformed broadcast: {}", e.getMessage());
            return null;
        }
    }

    public ConnectionState connectionState() {
        return manager.getConnectionState();
    }

    public UserPresence self() {
        return manager.getSelf();
    }

    public List<PresenceView> views() {
        return manager.getViews();
    }

    public boolean isSharing() {
        return manager.isSharing();
    }

    public void startSharing() {
        manager.startSharing();
    }

    /** Shares one captured position instead of tracking. */
    public void locateOnce() {
        manager.locateOnce();
    }

    public void stopSharing() {
        manager.stopSharing();
    }

    public void setStatus(PresenceStatus status, String message) {
        manager.setStatus(status, message);
    }

    public void setTrustLevel(String peerIdentity, TrustTier tier) {
        manager.setTrustLevel(peerIdentity, tier);
    }

    public TrustTier getTrustLevel(String peerIdentity) {
        return manager.getTrustLevel(peerIdentity);
    }

    public List<PresenceView> nearby(ProximityCategory maxCategory) {
        return manager.getUsersNearby(maxCategory);
    }

    public Subscription on(PresenceEventListener listener) {
        return manager.on(listener);
    }

    public PresenceManager manager() {
        return manager;
    }

    /** Stops the manager (sending a leave) and unsubscribes. The transport stays open. */
    @Override
    public synchronized void close() {
        manager.stop();
        if (inbound != null) {
            inbound.close();
            inbound = null;
        }
    }
}

package com.presencelite.engine;

import com.presencelite.broadcast.BroadcastCodec;
import com.presencelite.broadcast.BroadcastFactory;
import com.presencelite.broadcast.LocationPayload;
import com.presencelite.broadcast.MalformedBroadcastException;
import com.presencelite.broadcast.PresenceBroadcast;
import com.presencelite.broadcast.ProximityPayload;
import com.presencelite.broadcast.StatusPayload;
import com.presencelite.channel.BroadcastSender;
import com.presencelite.channel.TransportException;
import com.presencelite.crypto.CommitmentPrimitive;
import com.presencelite.crypto.Ed25519Verifier;
import com.presencelite.crypto.HashCommitmentPrimitive;
import com.presencelite.crypto.Identities;
import com.presencelite.crypto.Signer;
import com.presencelite.crypto.Verifier;
import com.presencelite.geo.GeohashCodec;
import com.presencelite.geo.HsrGeohashCodec;
import com.presencelite.geolocation.GeoFix;
import com.presencelite.geolocation.GeolocationException;
import com.presencelite.geolocation.GeolocationSource;
import com.presencelite.geolocation.LocationError;
import com.presencelite.geolocation.WatchHandle;
import com.presencelite.metrics.PresenceMetrics;
import com.presencelite.model.ConnectionState;
import com.presencelite.model.Coordinates;
import com.presencelite.model.DeviceType;
import com.presencelite.model.LocationFix;
import com.presencelite.model.LocationSource;
import com.presencelite.model.PresenceStatus;
import com.presencelite.model.PresenceView;
import com.presencelite.model.ProximityCategory;
import com.presencelite.model.ProximityInfo;
import com.presencelite.model.SpeedCategory;
import com.presencelite.model.TrustTier;
import com.presencelite.model.UserPresence;
import com.presencelite.policy.PrecisionPolicy;
import com.presencelite.trust.InMemoryTrustCircleStore;
import com.presencelite.trust.TrustCircleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Presence protocol engine for one local user in one channel.
 *
 * <p>Outbound, it turns fixes into signed multi-precision broadcasts and hands
 * them to a {@link BroadcastSender}. Inbound, it verifies peer broadcasts and
 * keeps one {@link PresenceView} per peer, projected at the precision the local
 * trust tier for that peer allows.
 *
 * <p>Every public mutator is synchronized on the manager, so the host thread,
 * the periodic scheduler and geolocation callbacks never observe a partially
 * applied update. Listeners run on the triggering thread while the lock is held.
 */
public class PresenceManager {

    private static final Logger log = LoggerFactory.getLogger(PresenceManager.class);

    /** Precision of the self commitment; receivers only ever get truncations of it. */
    static final int COMMITMENT_PRECISION = PrecisionPolicy.MAX_PRECISION;

    private final PresenceConfig config;
    private final Signer signer;
    private final Verifier verifier;
    private final CommitmentPrimitive commitments;
    private final TrustCircleStore trustStore;
    private final GeolocationSource geolocation;
    private final BroadcastCodec codec;
    private final BroadcastFactory factory;
    private final PresenceViewProjector projector;
    private final PresenceEventBus events;
    private final PresenceMetrics metrics;
    private final Clock clock;
    private final ScheduledExecutorService providedScheduler;

    // Guarded by this
    private final Map<String, PeerState> peers = new LinkedHashMap<>();
    private final Map<String, PresenceView> views = new LinkedHashMap<>();
    private final Map<String, Long> lastSequences = new HashMap<>();
    private final Map<String, Long> tombstones = new HashMap<>();
    private UserPresence self;
    private ConnectionState connectionState = ConnectionState.CONNECTING;
    private BroadcastSender sender;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tickFuture;
    private WatchHandle watchHandle;
    private long watchGeneration;
    private long activeWatchGeneration = -1;
    private long lastLocationBroadcastAt = -1;

    private PresenceManager(Builder b) {
        this.config = b.config;
        this.signer = b.signer;
        this.clock = b.clock;
        this.verifier = b.verifier;
        this.commitments = b.commitments != null ? b.commitments : new HashCommitmentPrimitive(b.geohashCodec, b.clock);
        this.trustStore = b.trustStore;
        this.geolocation = b.geolocation;
        this.metrics = b.metrics;
        this.providedScheduler = b.scheduler;
        this.codec = new BroadcastCodec(b.geohashCodec);
        this.factory = new BroadcastFactory(signer, codec, clock, config.presenceTtlSeconds());
        this.projector = new PresenceViewProjector(b.geohashCodec);
        this.events = new PresenceEventBus(metrics);
        this.self = new UserPresence(
            signer.identity(),
            config.displayName() != null ? config.displayName() : defaultDisplayName(signer.identity()),
            config.color() != null ? config.color() : defaultColor(signer.identity()),
            null,
            PresenceStatus.ONLINE,
            null,
            clock.millis(),
            false,
            config.deviceType());
    }

    public static Builder builder(PresenceConfig config, Signer signer) {
        return new Builder(config, signer);
    }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    /**
     * Connects the manager to {@code sender}: schedules the periodic
     * self-broadcast, sends the first one immediately and starts the location
     * watch when sharing is on by default.
     *
     * @throws IllegalStateException when already started or after {@link #stop()}
     */
    public synchronized void start(BroadcastSender sender) {
        if (connectionState == ConnectionState.DISCONNECTED) {
            throw new IllegalStateException("Presence manager was stopped and cannot be restarted");
        }
        if (this.sender != null) {
            throw new IllegalStateException("Presence manager already started");
        }
        this.sender = sender;
        transition(ConnectionState.CONNECTED);

        scheduler = providedScheduler != null ? providedScheduler : Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "presence-tick-" + config.channelId());
            thread.setDaemon(true);
            return thread;
        });
        long interval = config.updateIntervalMs();
        tickFuture = scheduler.scheduleAtFixedRate(this::scheduledTick, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Presence started in channel '{}' as {} (tick every {}ms, ttl {}s)",
            config.channelId(), Identities.shorten(self.identity()), interval, config.presenceTtlSeconds());

        broadcastPresence();
        if (config.shareLocationByDefault()) {
            startLocationWatch();
        }
    }

    /**
     * Cancels the timer and the location watch, sends a best-effort leave and
     * moves to {@link ConnectionState#DISCONNECTED}. Safe from any state;
     * later calls do nothing.
     */
    public synchronized void stop() {
        if (connectionState == ConnectionState.DISCONNECTED) {
            return;
        }
        if (tickFuture != null) {
            tickFuture.cancel(false);
            tickFuture = null;
        }
        if (scheduler != null && scheduler != providedScheduler) {
            scheduler.shutdownNow();
        }
        scheduler = null;
        stopLocationWatch();
        if (sender != null) {
            try {
                sender.send(codec.encode(factory.leave()));
                metrics.recordSent();
            } catch (TransportException | RuntimeException e) {
                metrics.recordSendFailure();
                log.warn("Leave broadcast not delivered: {}", e.getMessage());
            }
        }
        transition(ConnectionState.DISCONNECTED);
        log.info("Presence stopped in channel '{}'", config.channelId());
    }

    /**
     * One periodic cycle: re-broadcast self and expire silent peers. Driven by
     * the scheduler; callable directly.
     */
    public synchronized void tick() {
        if (connectionState == ConnectionState.DISCONNECTED || sender == null) {
            return;
        }
        broadcastPresence();
        expireStale();
    }

    private void scheduledTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            // An exception escaping here would cancel the schedule
            log.error("Presence tick failed", e);
        }
    }

    public synchronized ConnectionState getConnectionState() {
        return connectionState;
    }

    // ---------------------------------------------------------------------
    // Location sharing
    // ---------------------------------------------------------------------

    /**
     * Starts watching the geolocation source. Permission problems are reported
     * as an {@link PresenceEvent.ErrorOccurred} and leave sharing off; there is
     * no automatic retry.
     */
    public synchronized void startLocationWatch() {
        if (watchHandle != null || connectionState == ConnectionState.DISCONNECTED) {
            return;
        }
        if (geolocation == null) {
            reportLocationError(LocationError.unavailable("No geolocation source configured"));
            return;
        }
        long generation = ++watchGeneration;
        activeWatchGeneration = generation;
        try {
            watchHandle = geolocation.watch(
                fix -> onWatchFix(generation, fix),
                error -> onWatchError(generation, error));
            log.info("Location watch {} started", generation);
        } catch (GeolocationException e) {
            activeWatchGeneration = -1;
            reportLocationError(e.error());
        }
    }

    public synchronized void stopLocationWatch() {
        activeWatchGeneration = -1;
        if (watchHandle != null) {
            geolocation.clearWatch(watchHandle);
            watchHandle = null;
            log.info("Location watch stopped");
        }
    }

    /**
     * Captures a single fix and publishes it without starting a watch. The
     * location stays until {@link #clearLocation()} or the next fix.
     */
    public synchronized void locateOnce() {
        if (connectionState == ConnectionState.DISCONNECTED) {
            return;
        }
        if (geolocation == null) {
            reportLocationError(LocationError.unavailable("No geolocation source configured"));
            return;
        }
        geolocation.getCurrentFix(this::onSingleFix, this::reportSingleFixError);
    }

    public synchronized boolean isSharing() {
        return watchHandle != null;
    }

    public synchronized void startSharing() {
        startLocationWatch();
    }

    /** Stops the watch and forgets the self location. */
    public synchronized void stopSharing() {
        stopLocationWatch();
        clearLocation();
    }

    /** Manual fix, e.g. a pin dropped by the user. */
    public void setLocation(double latitude, double longitude) {
        setLocation(latitude, longitude, LocationSource.MANUAL);
    }

    public synchronized void setLocation(double latitude, double longitude, LocationSource source) {
        updateSelfLocation(new GeoFix(Coordinates.of(latitude, longitude), source, clock.millis()));
    }

    /** Forgets the self location and tells peers to drop theirs. */
    public synchronized void clearLocation() {
        if (self.location() == null) {
            return;
        }
        self = self.withLocation(null, false, clock.millis());
        reprojectAll();
        broadcastPresence();
    }

    private synchronized void onWatchFix(long generation, GeoFix fix) {
        if (generation != activeWatchGeneration) {
            log.debug("Ignoring fix from cancelled watch {}", generation);
            return;
        }
        updateSelfLocation(fix);
    }

    private synchronized void onWatchError(long generation, LocationError error) {
        if (generation != activeWatchGeneration) {
            return;
        }
        if (!error.kind().isTransient()) {
            stopLocationWatch();
        }
        reportLocationError(error);
    }

    private synchronized void onSingleFix(GeoFix fix) {
        if (connectionState == ConnectionState.DISCONNECTED) {
            return;
        }
        updateSelfLocation(fix);
    }

    private synchronized void reportSingleFixError(LocationError error) {
        reportLocationError(error);
    }

    private void reportLocationError(LocationError error) {
        log.warn("Location error {}: {}", error.kind(), error.message());
        events.publish(new PresenceEvent.ErrorOccurred("Location error: " + error.message(), error));
    }

    private void updateSelfLocation(GeoFix fix) {
        var coordinates = fix.coordinates();
        var commitment = commitments.create(coordinates.latitude(), coordinates.longitude(), COMMITMENT_PRECISION, signer);
        var location = new LocationFix(coordinates, fix.source(), fix.timestamp(), fix.source().isLive(), commitment);
        long now = clock.millis();
        self = self.withLocation(location, location.isMoving(), now);
        reprojectAll();

        if (lastLocationBroadcastAt >= 0 && now - lastLocationBroadcastAt < config.locationThrottleMs()) {
            // The next tick carries it
            metrics.recordThrottled();
            return;
        }
        broadcastLocation();
    }

    // ---------------------------------------------------------------------
    // Broadcasting
    // ---------------------------------------------------------------------

    private void broadcastPresence() {
        if (self.location() != null && self.status() != PresenceStatus.INVISIBLE) {
            broadcastLocation();
        } else {
            broadcastStatus();
        }
    }

    private void broadcastLocation() {
        if (!canSend()) {
            return;
        }
        var location = self.location();
        if (location == null || self.status() == PresenceStatus.INVISIBLE) {
            broadcastStatus();
            return;
        }
        var coordinates = location.coordinates();
        send(factory.location(
            location.commitment(),
            self.moving(),
            coordinates.heading(),
            SpeedCategory.of(coordinates.speed()),
            config.defaultPublicPrecision()));
        lastLocationBroadcastAt = clock.millis();
    }

    private void broadcastStatus() {
        if (!canSend()) {
            return;
        }
        boolean sharingLocation = self.location() != null && self.status() != PresenceStatus.INVISIBLE;
        send(factory.status(new StatusPayload(
            self.status(),
            self.statusMessage(),
            self.deviceType(),
            self.displayName(),
            self.color(),
            sharingLocation)));
    }

    private boolean canSend() {
        return sender != null && connectionState != ConnectionState.DISCONNECTED;
    }

    private void send(PresenceBroadcast broadcast) {
        byte[] bytes = codec.encode(broadcast);
        try {
            sender.send(bytes);
            metrics.recordSent();
            log.debug("Sent {} #{} ({} bytes)", broadcast.type(), broadcast.sequence(), bytes.length);
            if (connectionState == ConnectionState.RECONNECTING) {
                transition(ConnectionState.CONNECTED);
            }
        } catch (TransportException e) {
            metrics.recordSendFailure();
            log.warn("Failed to send {} #{}: {}", broadcast.type(), broadcast.sequence(), e.getMessage());
            if (connectionState == ConnectionState.CONNECTED) {
                transition(ConnectionState.RECONNECTING);
            }
        }
    }

    private void transition(ConnectionState next) {
        var previous = connectionState;
        if (previous == next) {
            return;
        }
        connectionState = next;
        log.info("Connection {} -> {}", previous, next);
        events.publish(new PresenceEvent.ConnectionChanged(previous, next));
    }

    /** Sets and broadcasts the local status. */
    public void setStatus(PresenceStatus status) {
        setStatus(status, null);
    }

    public synchronized void setStatus(PresenceStatus status, String message) {
        if (status == null) {
            throw new IllegalArgumentException("status must not be null");
        }
        self = self.withStatus(status, message);
        broadcastStatus();
    }

    /**
     * Tells {@code targetIdentity} which proximity category this side computed
     * for it, with the self commitment as proof.
     *
     * @return false when there is nothing to report: no self fix, no visible
     *         location for the target, invisible, or not connected
     */
    public synchronized boolean broadcastProximity(String targetIdentity) {
        var view = views.get(targetIdentity);
        var location = self.location();
        if (view == null || view.location() == null || location == null
            || self.status() == PresenceStatus.INVISIBLE || !canSend()) {
            return false;
        }
        var computed = ProximityCalculator.compute(location, view.location());
        send(factory.proximity(new ProximityPayload(targetIdentity, computed.category(), location.commitment().published())));
        return true;
    }

    // ---------------------------------------------------------------------
    // Receiving
    // ---------------------------------------------------------------------

    /**
     * Applies one peer broadcast. Structurally invalid broadcasts are dropped
     * as {@link IngestResult#MALFORMED}. Replays and out-of-order broadcasts
     * are ignored by sequence, so applying the same broadcast twice equals
     * applying it once.
     */
    public synchronized IngestResult handleBroadcast(PresenceBroadcast broadcast) {
        try {
            codec.validate(broadcast);
        } catch (MalformedBroadcastException e) {
            metrics.recordIngest(IngestResult.MALFORMED);
            log.debug("Dropped broadcast: {}", e.getMessage());
            return IngestResult.MALFORMED;
        }
        var result = ingest(broadcast);
        metrics.recordIngest(result);
        if (result != IngestResult.APPLIED) {
            log.debug("{} #{} from {}: {}", broadcast.type(), broadcast.sequence(),
                Identities.shorten(broadcast.senderIdentity()), result);
        }
        return result;
    }

    private IngestResult ingest(PresenceBroadcast b) {
        String senderId = b.senderIdentity();
        if (senderId.equals(self.identity())) {
            return IngestResult.IGNORED_SELF;
        }
        long now = clock.millis();
        if (b.isExpiredAt(now)) {
            return IngestResult.EXPIRED;
        }
        if (!verifier.verify(senderId, codec.signingBytes(b), b.signature())) {
            return IngestResult.UNVERIFIED;
        }
        Long last = lastSequences.get(senderId);
        if (last != null && b.sequence() <= last) {
            return IngestResult.STALE_SEQUENCE;
        }
        IngestResult result;
        var payload = b.payload();
        if (payload instanceof LocationPayload location) {
            result = applyLocation(b, location, now);
        } else if (payload instanceof StatusPayload status) {
            result = applyStatus(b, status, now);
        } else if (payload instanceof ProximityPayload proximity) {
            result = applyProximity(b, proximity, now);
        } else {
            // Only a leave carries no payload once validated
            result = applyLeave(b);
        }
        if (result == IngestResult.APPLIED) {
            lastSequences.put(senderId, b.sequence());
        }
        return result;
    }

    private IngestResult applyLocation(PresenceBroadcast b, LocationPayload payload, long now) {
        var peer = peers.get(b.senderIdentity());
        boolean joined = peer == null;
        if (joined) {
            peer = newPeer(b);
        }
        tombstones.remove(b.senderIdentity());
        var presence = peer.presence;
        // A location broadcast proves liveness; an explicit busy stays busy
        var status = presence.status() == PresenceStatus.BUSY ? PresenceStatus.BUSY : PresenceStatus.ONLINE;
        peer.presence = presence.withStatus(status, presence.statusMessage())
            .withMoving(payload.moving())
            .withLastSeen(b.timestamp());
        peer.location = payload;
        peer.commitmentVerified = commitments.verify(payload.commitment(), b.senderIdentity(), verifier);
        peer.reportedProximity = null;
        peer.ttlSeconds = b.ttlSeconds();

        var view = project(peer, now);
        if (joined) {
            events.publish(new PresenceEvent.UserJoined(peer.presence));
        } else {
            events.publish(new PresenceEvent.UserUpdated(peer.presence));
        }
        if (view.location() != null) {
            events.publish(new PresenceEvent.LocationUpdated(peer.identity(), view.location()));
        }
        return IngestResult.APPLIED;
    }

    private IngestResult applyStatus(PresenceBroadcast b, StatusPayload payload, long now) {
        var peer = peers.get(b.senderIdentity());
        boolean joined = peer == null;
        if (joined) {
            peer = newPeer(b);
        }
        tombstones.remove(b.senderIdentity());
        var presence = peer.presence;
        peer.presence = presence
            .withStatus(payload.status(), payload.message())
            .withProfile(
                payload.displayName() != null ? payload.displayName() : presence.displayName(),
                payload.color() != null ? payload.color() : presence.color(),
                payload.deviceType() != null ? payload.deviceType() : presence.deviceType())
            .withLastSeen(b.timestamp());
        peer.ttlSeconds = b.ttlSeconds();
        if (!payload.sharingLocation()) {
            peer.clearLocation();
            peer.presence = peer.presence.withMoving(false);
        }
        project(peer, now);
        if (joined) {
            events.publish(new PresenceEvent.UserJoined(peer.presence));
        }
        events.publish(new PresenceEvent.StatusChanged(peer.identity(), payload.status(), payload.message()));
        return IngestResult.APPLIED;
    }

    private IngestResult applyProximity(PresenceBroadcast b, ProximityPayload payload, long now) {
        if (!self.identity().equals(payload.targetIdentity())) {
            return IngestResult.NOT_APPLICABLE;
        }
        var peer = peers.get(b.senderIdentity());
        var current = views.get(b.senderIdentity());
        if (peer == null || current == null || current.location() == null) {
            return IngestResult.NOT_APPLICABLE;
        }
        var computed = ProximityCalculator.compute(self.location(), current.location());
        boolean verified = commitments.verify(payload.proof(), b.senderIdentity(), verifier);
        peer.reportedProximity = new ProximityInfo(
            payload.category(),
            verified,
            computed != null ? computed.approximateMeters() : null,
            computed != null && computed.mutuallyVisible());
        peer.presence = peer.presence.withLastSeen(Math.max(peer.presence.lastSeen(), b.timestamp()));
        project(peer, now);
        events.publish(new PresenceEvent.ProximityDetected(peer.identity(), peer.reportedProximity));
        return IngestResult.APPLIED;
    }

    private IngestResult applyLeave(PresenceBroadcast b) {
        String id = b.senderIdentity();
        var removed = peers.remove(id);
        views.remove(id);
        // Keeps out-of-order broadcasts from resurrecting the peer
        tombstones.put(id, b.expiresAt());
        if (removed != null) {
            log.info("Peer {} left", Identities.shorten(id));
            events.publish(new PresenceEvent.UserLeft(id));
        }
        return IngestResult.APPLIED;
    }

    private PeerState newPeer(PresenceBroadcast b) {
        String id = b.senderIdentity();
        var presence = new UserPresence(
            id, defaultDisplayName(id), defaultColor(id), null,
            PresenceStatus.ONLINE, null, b.timestamp(), false,
            DeviceType.UNKNOWN);
        var peer = new PeerState(presence, b.ttlSeconds());
        peers.put(id, peer);
        log.info("Peer {} joined", Identities.shorten(id));
        return peer;
    }

    // ---------------------------------------------------------------------
    // Expiry
    // ---------------------------------------------------------------------

    /**
     * Marks peers silent for half their TTL as away and removes peers silent
     * for the full TTL. Also prunes leave tombstones that have run out.
     */
    public synchronized void expireStale() {
        long now = clock.millis();
        List<String> expired = new ArrayList<>();
        List<PresenceEvent> wentAway = new ArrayList<>();
        for (var peer : peers.values()) {
            long silentMs = now - peer.presence.lastSeen();
            long ttlMs = peer.ttlSeconds * 1000L;
            if (silentMs > ttlMs) {
                expired.add(peer.identity());
            } else if (silentMs > ttlMs / 2 && peer.presence.status() == PresenceStatus.ONLINE) {
                peer.presence = peer.presence.withStatus(PresenceStatus.AWAY, peer.presence.statusMessage());
                project(peer, now);
                wentAway.add(new PresenceEvent.StatusChanged(peer.identity(), PresenceStatus.AWAY, peer.presence.statusMessage()));
            }
        }
        // Listeners may re-enter and add peers
        wentAway.forEach(events::publish);
        for (String id : expired) {
            peers.remove(id);
            views.remove(id);
            lastSequences.remove(id);
            metrics.recordPeerExpired();
            log.info("Peer {} expired", Identities.shorten(id));
            events.publish(new PresenceEvent.UserLeft(id));
        }
        tombstones.entrySet().removeIf(entry -> {
            if (entry.getValue() < now) {
                lastSequences.remove(entry.getKey());
                return true;
            }
            return false;
        });
    }

    // ---------------------------------------------------------------------
    // Trust
    // ---------------------------------------------------------------------

    /** Stores the tier and re-projects the peer at once, without a new broadcast. */
    public synchronized void setTrustLevel(String peerIdentity, TrustTier tier) {
        if (tier == null) {
            throw new IllegalArgumentException("tier must not be null");
        }
        trustStore.setTrustLevel(peerIdentity, tier);
        reproject(peerIdentity);
    }

    /** Forgets the tier; the peer falls back to public precision. */
    public synchronized void removeTrustLevel(String peerIdentity) {
        if (trustStore.removeTrustLevel(peerIdentity)) {
            reproject(peerIdentity);
        }
    }

    /** The stored tier, or {@link TrustTier#PUBLIC} for unknown peers. */
    public TrustTier getTrustLevel(String peerIdentity) {
        return trustStore.getTrustLevel(peerIdentity).orElse(TrustTier.PUBLIC);
    }

    private void reproject(String peerIdentity) {
        var peer = peers.get(peerIdentity);
        if (peer == null) {
            return;
        }
        var view = project(peer, clock.millis());
        if (view.location() != null) {
            events.publish(new PresenceEvent.LocationUpdated(peerIdentity, view.location()));
        }
    }

    private void reprojectAll() {
        long now = clock.millis();
        for (var peer : peers.values()) {
            project(peer, now);
        }
    }

    private PresenceView project(PeerState peer, long now) {
        var view = projector.project(peer, getTrustLevel(peer.identity()), self.location(), now);
        views.put(peer.identity(), view);
        return view;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    public synchronized List<PresenceView> getViews() {
        return List.copyOf(views.values());
    }

    public synchronized Optional<PresenceView> getView(String peerIdentity) {
        return Optional.ofNullable(views.get(peerIdentity));
    }

    public synchronized UserPresence getSelf() {
        return self;
    }

    public String identity() {
        return signer.identity();
    }

    public PresenceConfig config() {
        return config;
    }

    public PresenceMetrics metrics() {
        return metrics;
    }

    /** Peers whose status is online or away. */
    public synchronized List<UserPresence> getOnlineUsers() {
        return peers.values().stream()
            .map(peer -> peer.presence)
            .filter(presence -> presence.status().isReachable())
            .toList();
    }

    public List<PresenceView> getUsersNearby() {
        return getUsersNearby(ProximityCategory.SAME_AREA);
    }

    /** Views whose proximity is {@code maxCategory} or closer. */
    public synchronized List<PresenceView> getUsersNearby(ProximityCategory maxCategory) {
        return views.values().stream()
            .filter(view -> view.proximity() != null && view.proximity().category().isWithin(maxCategory))
            .toList();
    }

    public Subscription on(PresenceEventListener listener) {
        return events.subscribe(listener);
    }

    /** Identity used when a peer has not announced a display name. */
    static String defaultDisplayName(String identity) {
        return Identities.shorten(identity) + "...";
    }

    /** Stable per-identity hue so a peer keeps its colour across sessions. */
    static String defaultColor(String identity) {
        return "hsl(" + Math.floorMod(identity.hashCode(), 360) + ", 70%, 50%)";
    }

    public static final class Builder {
        private final PresenceConfig config;
        private final Signer signer;
        private Verifier verifier = new Ed25519Verifier();
        private GeohashCodec geohashCodec = new HsrGeohashCodec();
        private CommitmentPrimitive commitments;
        private TrustCircleStore trustStore = new InMemoryTrustCircleStore();
        private GeolocationSource geolocation;
        private Clock clock = Clock.systemUTC();
        private ScheduledExecutorService scheduler;
        private PresenceMetrics metrics = new PresenceMetrics();

        private Builder(PresenceConfig config, Signer signer) {
            this.config = config;
            this.signer = signer;
        }

        public Builder verifier(Verifier verifier) { this.verifier = verifier; return this; }
        public Builder geohashCodec(GeohashCodec codec) { this.geohashCodec = codec; return this; }
        /** Defaults to {@link HashCommitmentPrimitive} over the geohash codec and clock. */
        public Builder commitments(CommitmentPrimitive commitments) { this.commitments = commitments; return this; }
        public Builder trustStore(TrustCircleStore trustStore) { this.trustStore = trustStore; return this; }
        public Builder geolocation(GeolocationSource geolocation) { this.geolocation = geolocation; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        /** Shared scheduler; the manager does not shut it down. Without one it owns a private thread. */
        public Builder scheduler(ScheduledExecutorService scheduler) { this.scheduler = scheduler; return this; }
        public Builder metrics(PresenceMetrics metrics) { this.metrics = metrics; return this; }

        public PresenceManager build() {
            if (config == null || signer == null) {
                throw new IllegalArgumentException("config and signer are required");
            }
            return new PresenceManager(this);
        }
    }
}

package com.presencelite.engine;

import com.presencelite.broadcast.BroadcastCodec;
import com.presencelite.broadcast.BroadcastFactory;
import com.presencelite.broadcast.BroadcastPayload;
import com.presencelite.broadcast.BroadcastType;
import com.presencelite.broadcast.LocationPayload;
import com.presencelite.broadcast.PrecisionLevel;
import com.presencelite.broadcast.PresenceBroadcast;
import com.presencelite.broadcast.ProximityPayload;
import com.presencelite.broadcast.StatusPayload;
import com.presencelite.crypto.Ed25519Signer;
import com.presencelite.crypto.HashCommitmentPrimitive;
import com.presencelite.crypto.Identities;
import com.presencelite.geo.GeoMath;
import com.presencelite.geo.HsrGeohashCodec;
import com.presencelite.geolocation.GeoFix;
import com.presencelite.geolocation.LocationError;
import com.presencelite.geolocation.LocationErrorKind;
import com.presencelite.model.ConnectionState;
import com.presencelite.model.Coordinates;
import com.presencelite.model.GeoPoint;
import com.presencelite.model.LocationCommitment;
import com.presencelite.model.LocationSource;
import com.presencelite.model.PresenceStatus;
import com.presencelite.model.PresenceView;
import com.presencelite.model.ProximityCategory;
import com.presencelite.model.SpeedCategory;
import com.presencelite.model.TrustTier;
import com.presencelite.support.FakeGeolocationSource;
import com.presencelite.support.MutableClock;
import com.presencelite.support.RecordingTransport;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PresenceManagerTest {

    private static final long T0 = 1_700_000_000_000L;
    private static final GeoPoint SF = new HsrGeohashCodec().decode("9q8yyk8y");

    private final MutableClock clock = new MutableClock(T0);
    private final HsrGeohashCodec geohash = new HsrGeohashCodec();
    private final BroadcastCodec codec = new BroadcastCodec(geohash);
    private final FakeGeolocationSource geolocation = new FakeGeolocationSource();
    private final RecordingTransport transport = new RecordingTransport();
    private final List<PresenceEvent> events = new CopyOnWriteArrayList<>();
    private PresenceManager manager;

    @BeforeEach
    void setUp() {
        manager = newManager(baseConfig().build());
        manager.on(events::add);
        manager.start(transport);
    }

    @AfterEach
    void tearDown() {
        manager.stop();
    }

    private static PresenceConfig.Builder baseConfig() {
        // Long interval keeps the real scheduler out of the way; tests call tick()
        return PresenceConfig.builder("test-room")
            .updateIntervalMs(600_000)
            .locationThrottleMs(1_000)
            .presenceTtlSeconds(60);
    }

    private PresenceManager newManager(PresenceConfig config) {
        return PresenceManager.builder(config, Ed25519Signer.generate())
            .clock(clock)
            .geolocation(geolocation)
            .build();
    }

    private PresenceView view(TestPeer peer) {
        return manager.getView(peer.id()).orElseThrow(() -> new AssertionError("no view for peer"));
    }

    private <T extends PresenceEvent> List<T> eventsOf(Class<T> type) {
        return events.stream().filter(type::isInstance).map(type::cast).toList();
    }

    private GeoFix fix(double lat, double lng) {
        return new GeoFix(Coordinates.of(lat, lng), LocationSource.GPS, clock.millis());
    }

    // ---------------------------------------------------------------------
    // Trust-scoped projection
    // ---------------------------------------------------------------------

    @Test
    void unknownPeer_seesOnlyPublicPrecision() {
        var peer = new TestPeer();
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(peer.at(SF)));

        var view = view(peer);
        assertEquals(TrustTier.PUBLIC, view.trustTier());
        assertEquals("9q", view.location().geohash());
        assertEquals(2, view.location().precision());
        assertTrue(view.verified());
        assertEquals(PresenceStatus.ONLINE, view.status());
        assertEquals(T0, view.lastSeen());

        assertInstanceOf(PresenceEvent.UserJoined.class, events.get(events.size() - 2));
        var located = assertInstanceOf(PresenceEvent.LocationUpdated.class, events.get(events.size() - 1));
        assertEquals(peer.id(), located.identity());
    }

    @Test
    void friendsTier_seesNeighbourhoodCell() {
        var peer = new TestPeer();
        manager.setTrustLevel(peer.id(), TrustTier.FRIENDS);
        manager.handleBroadcast(peer.at(SF));

        var location = view(peer).location();
        assertEquals("9q8yy", location.geohash());
        assertEquals(5, location.precision());
        assertEquals(2_400, location.uncertaintyRadiusMeters());
        assertTrue(location.bounds().contains(SF.latitude(), SF.longitude()));
    }

    @Test
    void trustChange_reprojectsWithoutNewBroadcast() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.at(SF));
        events.clear();

        manager.setTrustLevel(peer.id(), TrustTier.CLOSE);
        assertEquals("9q8yyk8", view(peer).location().geohash());
        assertEquals(TrustTier.CLOSE, view(peer).trustTier());
        assertEquals(1, eventsOf(PresenceEvent.LocationUpdated.class).size());

        manager.removeTrustLevel(peer.id());
        assertEquals("9q", view(peer).location().geohash());
        assertEquals(TrustTier.PUBLIC, manager.getTrustLevel(peer.id()));
    }

    @Test
    void finerLevelThanTierAllows_isTruncated() {
        var peer = new TestPeer();
        manager.setTrustLevel(peer.id(), TrustTier.FRIENDS);
        var commitment = peer.commit(SF);
        var greedy = new LocationPayload(commitment.published(),
            List.of(new PrecisionLevel(TrustTier.FRIENDS, commitment.fullGeohash().substring(0, 9), 9)),
            false, null, SpeedCategory.STATIONARY);

        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(peer.signed(BroadcastType.LOCATION, greedy, 1)));
        assertEquals("9q8yy", view(peer).location().geohash());
        assertEquals(5, view(peer).location().precision());
    }

    @Test
    void missingTierLevel_fallsBackToCoarsestAndTruncates() {
        var peer = new TestPeer();
        var commitment = peer.commit(SF);
        var intimateOnly = new LocationPayload(commitment.published(),
            List.of(new PrecisionLevel(TrustTier.INTIMATE, commitment.fullGeohash().substring(0, 9), 9)),
            false, null, null);

        manager.handleBroadcast(peer.signed(BroadcastType.LOCATION, intimateOnly, 1));
        assertEquals("9q", view(peer).location().geohash());
    }

    // ---------------------------------------------------------------------
    // Ingest rules
    // ---------------------------------------------------------------------

    @Test
    void ttlBoundary_isInclusive() {
        var peer = new TestPeer();
        var first = peer.at(SF);
        var second = peer.at(SF);

        clock.set(T0 + 60_001);
        assertEquals(IngestResult.EXPIRED, manager.handleBroadcast(first));
        clock.set(T0 + 60_000);
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(second));
        assertEquals(1, manager.metrics().snapshot().expired());
    }

    @Test
    void replayedBroadcast_isIgnored() {
        var peer = new TestPeer();
        var broadcast = peer.at(SF);
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(broadcast));
        var before = manager.getViews();
        int eventCount = events.size();

        assertEquals(IngestResult.STALE_SEQUENCE, manager.handleBroadcast(broadcast));
        assertEquals(before, manager.getViews());
        assertEquals(eventCount, events.size());
    }

    @Test
    void outOfOrderBroadcast_doesNotRollBack() {
        var peer = new TestPeer();
        manager.setTrustLevel(peer.id(), TrustTier.INTIMATE);
        var older = peer.at(SF);
        var newer = peer.at(GeoMath.offsetNorth(SF, 1_000));

        manager.handleBroadcast(newer);
        assertEquals(IngestResult.STALE_SEQUENCE, manager.handleBroadcast(older));
        assertEquals(((LocationPayload) newer.payload()).precisionLevels().get(4).geohash(),
            view(peer).location().geohash());
    }

    @Test
    void leave_removesPeerAndBlocksDelayedBroadcasts() {
        var peer = new TestPeer();
        var first = peer.at(SF);
        var delayed = peer.at(SF);
        var leave = peer.factory.leave();

        manager.handleBroadcast(first);
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(leave));
        assertTrue(manager.getViews().isEmpty());
        assertEquals(peer.id(), eventsOf(PresenceEvent.UserLeft.class).get(0).identity());

        assertEquals(IngestResult.STALE_SEQUENCE, manager.handleBroadcast(delayed));
        assertTrue(manager.getViews().isEmpty());
    }

    @Test
    void ownBroadcasts_areIgnored() {
        var own = transport.last();
        assertEquals(manager.identity(), own.senderIdentity());
        assertEquals(IngestResult.IGNORED_SELF, manager.handleBroadcast(own));
        assertTrue(manager.getViews().isEmpty());
    }

    @Test
    void tamperedOrForeignSignature_isUnverified() {
        var peer = new TestPeer();
        var original = peer.at(SF);
        var tampered = new PresenceBroadcast(original.senderIdentity(), original.type(), original.payload(),
            original.signature(), original.timestamp() + 1, original.sequence(), original.ttlSeconds());
        var impostor = new TestPeer();
        var forged = new PresenceBroadcast(peer.id(), original.type(), original.payload(),
            impostor.signer.sign(codec.signingBytes(original)), original.timestamp(), original.sequence(), original.ttlSeconds());

        assertEquals(IngestResult.UNVERIFIED, manager.handleBroadcast(tampered));
        assertEquals(IngestResult.UNVERIFIED, manager.handleBroadcast(forged));
        assertTrue(manager.getViews().isEmpty());
        assertEquals(2, manager.metrics().snapshot().unverified());
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(original));
    }

    @Test
    void signedLocationWithStatusPayload_isMalformed() {
        var peer = new TestPeer();
        var status = new StatusPayload(PresenceStatus.ONLINE, null, null, "Ana", null, true);

        assertEquals(IngestResult.MALFORMED, manager.handleBroadcast(peer.signed(BroadcastType.LOCATION, status, 1)));
        assertTrue(manager.getViews().isEmpty());
        assertEquals(1, manager.metrics().snapshot().malformed());
    }

    @Test
    void signedLocationWithoutPayload_isMalformed() {
        var peer = new TestPeer();

        assertEquals(IngestResult.MALFORMED, manager.handleBroadcast(peer.signed(BroadcastType.LOCATION, null, 1)));
        assertTrue(manager.getViews().isEmpty());
    }

    @Test
    void levelClaimingMorePrecisionThanItsGeohash_isMalformed() {
        var peer = new TestPeer();
        var commitment = peer.commit(SF);
        var shortLevel = new LocationPayload(commitment.published(),
            List.of(new PrecisionLevel(TrustTier.PUBLIC, "9", 2)),
            false, null, null);

        assertEquals(IngestResult.MALFORMED, manager.handleBroadcast(peer.signed(BroadcastType.LOCATION, shortLevel, 1)));
        assertTrue(manager.getViews().isEmpty());

        // A malformed broadcast does not consume the sequence
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(peer.at(SF)));
    }

    @Test
    void statusWithoutSharing_clearsLocation() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.at(SF));
        manager.handleBroadcast(peer.status(PresenceStatus.AWAY, "lunch", false));

        var view = view(peer);
        assertNull(view.location());
        assertNull(view.proximity());
        assertEquals(PresenceStatus.AWAY, view.status());
        var changed = eventsOf(PresenceEvent.StatusChanged.class);
        assertEquals("lunch", changed.get(changed.size() - 1).message());
    }

    @Test
    void firstStatus_joinsPeerWithProfile() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.status(PresenceStatus.ONLINE, null, false));

        assertEquals("Ana", view(peer).displayName());
        assertEquals("#ff8800", view(peer).color());
        assertInstanceOf(PresenceEvent.UserJoined.class, events.get(events.size() - 2));
        assertInstanceOf(PresenceEvent.StatusChanged.class, events.get(events.size() - 1));
    }

    @Test
    void peerWithoutProfile_getsDefaults() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.at(SF));
        assertEquals(Identities.shorten(peer.id()) + "...", view(peer).displayName());
        assertTrue(view(peer).color().matches("hsl\\(\\d{1,3}, 70%, 50%\\)"), view(peer).color());
    }

    @Test
    void locationAfterBusy_keepsBusy() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.status(PresenceStatus.BUSY, "focus", true));
        manager.handleBroadcast(peer.at(SF));
        assertEquals(PresenceStatus.BUSY, view(peer).status());
    }

    // ---------------------------------------------------------------------
    // Proximity
    // ---------------------------------------------------------------------

    @Test
    void computedProximity_usesViewableCell() {
        var near = new TestPeer();
        var far = new TestPeer();
        manager.setTrustLevel(near.id(), TrustTier.INTIMATE);
        manager.setTrustLevel(far.id(), TrustTier.INTIMATE);
        manager.setLocation(SF.latitude(), SF.longitude());
        manager.handleBroadcast(near.at(GeoMath.offsetNorth(SF, 300)));
        manager.handleBroadcast(far.at(GeoMath.offsetNorth(SF, 100_000)));

        var proximity = view(near).proximity();
        assertEquals(ProximityCategory.NEARBY, proximity.category());
        assertFalse(proximity.verified());
        assertEquals(300, proximity.approximateMeters(), 10);
        assertEquals(ProximityCategory.FAR, view(far).proximity().category());

        assertEquals(List.of(near.id()), manager.getUsersNearby().stream().map(PresenceView::peerIdentity).toList());
        assertTrue(manager.getUsersNearby(ProximityCategory.HERE).isEmpty());
    }

    @Test
    void proximityWithoutSelfFix_isUnknown() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.at(SF));
        var proximity = view(peer).proximity();
        assertEquals(ProximityCategory.FAR, proximity.category());
        assertNull(proximity.approximateMeters());
        assertFalse(proximity.verified());
    }

    @Test
    void reportedProximity_overridesComputedUntilNextLocation() {
        var peer = new TestPeer();
        manager.setTrustLevel(peer.id(), TrustTier.INTIMATE);
        manager.setLocation(SF.latitude(), SF.longitude());
        manager.handleBroadcast(peer.at(GeoMath.offsetNorth(SF, 300)));

        var report = new ProximityPayload(manager.identity(), ProximityCategory.HERE, peer.lastCommitment.published());
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(peer.factory.proximity(report)));
        assertEquals(ProximityCategory.HERE, view(peer).proximity().category());
        assertTrue(view(peer).proximity().verified());
        var detected = eventsOf(PresenceEvent.ProximityDetected.class);
        assertEquals(1, detected.size());
        assertEquals(peer.id(), detected.get(0).identity());

        manager.handleBroadcast(peer.at(GeoMath.offsetNorth(SF, 300)));
        assertEquals(ProximityCategory.NEARBY, view(peer).proximity().category());
        assertFalse(view(peer).proximity().verified());
    }

    @Test
    void proximityForSomeoneElseOrUnknownPeer_isNotApplicable() {
        var peer = new TestPeer();
        var stranger = new TestPeer();
        manager.handleBroadcast(peer.at(SF));

        var elsewhere = new ProximityPayload(stranger.id(), ProximityCategory.HERE, peer.lastCommitment.published());
        assertEquals(IngestResult.NOT_APPLICABLE, manager.handleBroadcast(peer.factory.proximity(elsewhere)));

        stranger.commit(SF);
        var unknown = new ProximityPayload(manager.identity(), ProximityCategory.HERE, stranger.lastCommitment.published());
        assertEquals(IngestResult.NOT_APPLICABLE, manager.handleBroadcast(stranger.factory.proximity(unknown)));
        assertEquals(2, manager.metrics().snapshot().notApplicable());
    }

    @Test
    void broadcastProximity_sendsComputedCategoryWithProof() {
        var peer = new TestPeer();
        assertFalse(manager.broadcastProximity(peer.id()));

        manager.setTrustLevel(peer.id(), TrustTier.INTIMATE);
        manager.handleBroadcast(peer.at(GeoMath.offsetNorth(SF, 20)));
        assertFalse(manager.broadcastProximity(peer.id()), "no self fix yet");

        manager.setLocation(SF.latitude(), SF.longitude());
        assertTrue(manager.broadcastProximity(peer.id()));
        var sent = transport.last();
        assertEquals(BroadcastType.PROXIMITY, sent.type());
        var payload = (ProximityPayload) sent.payload();
        assertEquals(peer.id(), payload.targetIdentity());
        assertEquals(ProximityCategory.HERE, payload.category());
        assertEquals(manager.getSelf().location().commitment().published(), payload.proof());
    }

    // ---------------------------------------------------------------------
    // Lifecycle and connection
    // ---------------------------------------------------------------------

    @Test
    void start_connectsAndAnnounces() {
        var connection = eventsOf(PresenceEvent.ConnectionChanged.class);
        assertEquals(ConnectionState.CONNECTING, connection.get(0).previous());
        assertEquals(ConnectionState.CONNECTED, connection.get(0).current());
        assertEquals(ConnectionState.CONNECTED, manager.getConnectionState());

        var announced = transport.last();
        assertEquals(BroadcastType.STATUS, announced.type());
        assertFalse(((StatusPayload) announced.payload()).sharingLocation());
        assertThrows(IllegalStateException.class, () -> manager.start(transport));
    }

    @Test
    void stop_sendsLeaveOnceAndIsTerminal() {
        manager.stop();
        manager.stop();

        assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
        assertEquals(1, transport.sentOfType(BroadcastType.LEAVE).size());
        assertEquals(BroadcastType.LEAVE, transport.last().type());
        assertThrows(IllegalStateException.class, () -> manager.start(transport));

        int sent = transport.sentBytes().size();
        manager.tick();
        manager.setStatus(PresenceStatus.BUSY);
        assertEquals(sent, transport.sentBytes().size());
    }

    @Test
    void stopBeforeStart_disconnectsQuietly() {
        var idle = newManager(baseConfig().build());
        idle.stop();
        assertEquals(ConnectionState.DISCONNECTED, idle.getConnectionState());
        assertThrows(IllegalStateException.class, () -> idle.start(transport));
    }

    @Test
    void sendFailure_reconnectsOnNextSuccess() {
        transport.setFailing(true);
        manager.setStatus(PresenceStatus.BUSY, "meeting");
        assertEquals(ConnectionState.RECONNECTING, manager.getConnectionState());
        assertEquals(1, manager.metrics().snapshot().sendFailures());

        transport.setFailing(false);
        manager.tick();
        assertEquals(ConnectionState.CONNECTED, manager.getConnectionState());
        var connection = eventsOf(PresenceEvent.ConnectionChanged.class);
        assertEquals(ConnectionState.RECONNECTING, connection.get(connection.size() - 1).previous());
        var status = (StatusPayload) transport.last().payload();
        assertEquals(PresenceStatus.BUSY, status.status());
        assertEquals("meeting", status.message());
    }

    @Test
    void shareLocationByDefault_startsWatch() {
        var sharing = newManager(baseConfig().shareLocationByDefault(true).build());
        try {
            sharing.start(new RecordingTransport());
            assertTrue(sharing.isSharing());
            assertEquals(1, geolocation.activeWatchCount());
        } finally {
            sharing.stop();
        }
        assertEquals(0, geolocation.activeWatchCount());
    }

    // ---------------------------------------------------------------------
    // Location sharing
    // ---------------------------------------------------------------------

    @Test
    void watchFix_broadcastsLocation() {
        manager.startSharing();
        geolocation.emitFix(fix(SF.latitude(), SF.longitude()));

        var self = manager.getSelf();
        assertNotNull(self.location());
        assertEquals(LocationSource.GPS, self.location().source());
        var sent = transport.last();
        assertEquals(BroadcastType.LOCATION, sent.type());
        var payload = (LocationPayload) sent.payload();
        assertEquals(5, payload.precisionLevels().size());
        assertEquals("9q", payload.precisionLevels().get(0).geohash());
    }

    @Test
    void stopSharing_clearsLocationAndIgnoresLateFix() {
        manager.startSharing();
        geolocation.emitFix(fix(SF.latitude(), SF.longitude()));
        manager.stopSharing();

        assertFalse(manager.isSharing());
        assertNull(manager.getSelf().location());
        var status = transport.last();
        assertEquals(BroadcastType.STATUS, status.type());
        assertFalse(((StatusPayload) status.payload()).sharingLocation());

        int sent = transport.sentBytes().size();
        geolocation.emitFixIncludingCleared(fix(SF.latitude(), SF.longitude()));
        assertNull(manager.getSelf().location());
        assertEquals(sent, transport.sentBytes().size());
    }

    @Test
    void permissionDeniedAtStart_reportsErrorAndStaysOff() {
        geolocation.failWatchWith(LocationError.permissionDenied("user said no"));
        manager.startSharing();

        assertFalse(manager.isSharing());
        var error = eventsOf(PresenceEvent.ErrorOccurred.class).get(0);
        assertEquals(LocationErrorKind.PERMISSION_DENIED, error.locationError().kind());
        assertTrue(error.message().contains("user said no"));
    }

    @Test
    void permissionRevokedDuringWatch_stopsSharing() {
        manager.startSharing();
        geolocation.emitError(LocationError.permissionDenied("revoked"));

        assertFalse(manager.isSharing());
        assertEquals(0, geolocation.activeWatchCount());
        assertEquals(1, eventsOf(PresenceEvent.ErrorOccurred.class).size());
    }

    @Test
    void transientError_keepsWatching() {
        manager.startSharing();
        geolocation.emitError(new LocationError(LocationErrorKind.TIMEOUT, "slow fix"));

        assertTrue(manager.isSharing());
        assertEquals(LocationErrorKind.TIMEOUT, eventsOf(PresenceEvent.ErrorOccurred.class).get(0).locationError().kind());
    }

    @Test
    void locateOnce_publishesSingleFixWithoutWatching() {
        geolocation.setCurrentFix(fix(SF.latitude(), SF.longitude()));
        manager.locateOnce();

        assertFalse(manager.isSharing());
        assertEquals(0, geolocation.totalWatchCount());
        assertEquals(SF.latitude(), manager.getSelf().location().coordinates().latitude());
        assertEquals(1, transport.sentOfType(BroadcastType.LOCATION).size());
    }

    @Test
    void locateOnce_withoutFix_reportsError() {
        manager.locateOnce();

        assertNull(manager.getSelf().location());
        assertEquals(LocationErrorKind.POSITION_UNAVAILABLE,
            eventsOf(PresenceEvent.ErrorOccurred.class).get(0).locationError().kind());
    }

    @Test
    void nanCoordinates_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> manager.setLocation(Double.NaN, Double.NaN));
        assertNull(manager.getSelf().location());
        assertTrue(transport.sentOfType(BroadcastType.LOCATION).isEmpty());
    }

    @Test
    void rapidFixes_areThrottledAndCarriedByTick() {
        manager.startSharing();
        geolocation.emitFix(fix(SF.latitude(), SF.longitude()));
        assertEquals(1, transport.sentOfType(BroadcastType.LOCATION).size());

        clock.advance(500);
        var moved = GeoMath.offsetNorth(SF, 200);
        geolocation.emitFix(fix(moved.latitude(), moved.longitude()));
        assertEquals(1, transport.sentOfType(BroadcastType.LOCATION).size());
        assertEquals(1, manager.metrics().snapshot().locationsThrottled());
        assertEquals(moved.latitude(), manager.getSelf().location().coordinates().latitude());

        manager.tick();
        var carried = (LocationPayload) transport.last().payload();
        assertEquals(manager.getSelf().location().commitment().published(), carried.commitment());

        clock.advance(1_001);
        geolocation.emitFix(fix(SF.latitude(), SF.longitude()));
        assertEquals(3, transport.sentOfType(BroadcastType.LOCATION).size());
    }

    @Test
    void invisible_sendsStatusOnly() {
        manager.setLocation(SF.latitude(), SF.longitude());
        var peer = new TestPeer();
        manager.handleBroadcast(peer.at(SF));
        transport.clear();

        manager.setStatus(PresenceStatus.INVISIBLE);
        manager.tick();
        assertFalse(manager.broadcastProximity(peer.id()));

        assertTrue(transport.sentOfType(BroadcastType.LOCATION).isEmpty());
        for (var sent : transport.sentOfType(BroadcastType.STATUS)) {
            var status = (StatusPayload) sent.payload();
            assertEquals(PresenceStatus.INVISIBLE, status.status());
            assertFalse(status.sharingLocation());
        }
    }

    @Test
    void wire_neverCarriesFullPrecision() {
        manager.setLocation(37.7749, -122.4194);
        manager.tick();
        String finer = geohash.encode(37.7749, -122.4194, 12).substring(0, 10);
        for (byte[] bytes : transport.sentBytes()) {
            assertFalse(new String(bytes, StandardCharsets.UTF_8).contains(finer));
        }
    }

    // ---------------------------------------------------------------------
    // Expiry, listeners and queries
    // ---------------------------------------------------------------------

    @Test
    void silentPeer_goesAwayThenExpires() {
        var peer = new TestPeer();
        manager.handleBroadcast(peer.at(SF));

        clock.set(T0 + 30_001);
        manager.expireStale();
        assertEquals(PresenceStatus.AWAY, view(peer).status());
        assertEquals(List.of(peer.id()), manager.getOnlineUsers().stream().map(u -> u.identity()).toList());
        var away = eventsOf(PresenceEvent.StatusChanged.class);
        assertEquals(PresenceStatus.AWAY, away.get(away.size() - 1).status());

        clock.set(T0 + 60_001);
        manager.expireStale();
        assertTrue(manager.getViews().isEmpty());
        assertEquals(1, manager.metrics().snapshot().peersExpired());
        assertEquals(peer.id(), eventsOf(PresenceEvent.UserLeft.class).get(0).identity());

        var restarted = new BroadcastFactory(peer.signer, codec, clock, 60);
        var commitment = new HashCommitmentPrimitive(geohash, clock).create(SF.latitude(), SF.longitude(), 12, peer.signer);
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(
            restarted.location(commitment, false, null, SpeedCategory.STATIONARY, 2)));
    }

    @Test
    void listenerAddingPeerDuringExpiry_isSafe() {
        var first = new TestPeer();
        var second = new TestPeer();
        manager.handleBroadcast(first.at(SF));
        manager.handleBroadcast(second.at(SF));

        clock.set(T0 + 30_001);
        var newcomer = new TestPeer();
        var hello = newcomer.at(SF);
        manager.on(event -> {
            if (event instanceof PresenceEvent.StatusChanged) {
                manager.handleBroadcast(hello);
            }
        });

        manager.expireStale();
        assertEquals(PresenceStatus.AWAY, view(first).status());
        assertEquals(PresenceStatus.AWAY, view(second).status());
        assertEquals(PresenceStatus.ONLINE, view(newcomer).status());
    }

    @Test
    void failingListener_doesNotStarveOthers() {
        List<PresenceEvent> received = new CopyOnWriteArrayList<>();
        manager.on(event -> {
            throw new IllegalStateException("listener bug");
        });
        manager.on(received::add);

        var peer = new TestPeer();
        assertEquals(IngestResult.APPLIED, manager.handleBroadcast(peer.at(SF)));
        assertEquals(2, received.size());
        assertEquals(2, manager.metrics().snapshot().listenerErrors());
    }

    @Test
    void unsubscribedListener_stopsReceiving() {
        List<PresenceEvent> received = new CopyOnWriteArrayList<>();
        var subscription = manager.on(received::add);
        subscription.close();
        manager.handleBroadcast(new TestPeer().at(SF));
        assertTrue(received.isEmpty());
    }

    @Test
    void views_areSnapshots() {
        manager.handleBroadcast(new TestPeer().at(SF));
        var views = manager.getViews();
        assertThrows(UnsupportedOperationException.class, () -> views.remove(0));
        manager.handleBroadcast(new TestPeer().at(SF));
        assertEquals(1, views.size());
        assertEquals(2, manager.getViews().size());
    }

    @Test
    void self_usesConfiguredOrDefaultProfile() {
        var self = manager.getSelf();
        assertEquals(Identities.shorten(manager.identity()) + "...", self.displayName());
        assertEquals(PresenceStatus.ONLINE, self.status());

        var named = newManager(baseConfig().displayName("Bo").color("#123456").build());
        assertEquals("Bo", named.getSelf().displayName());
        assertEquals("#123456", named.getSelf().color());
    }

    /** A remote participant that signs its own broadcasts. */
    private final class TestPeer {
        final Ed25519Signer signer = Ed25519Signer.generate();
        final BroadcastFactory factory = new BroadcastFactory(signer, codec, clock, 60);
        final HashCommitmentPrimitive commitments = new HashCommitmentPrimitive(geohash, clock);
        LocationCommitment lastCommitment;

        String id() {
            return signer.identity();
        }

        LocationCommitment commit(GeoPoint point) {
            lastCommitment = commitments.create(point.latitude(), point.longitude(), 12, signer);
            return lastCommitment;
        }

        PresenceBroadcast at(GeoPoint point) {
            return factory.location(commit(point), false, null, SpeedCategory.STATIONARY, 2);
        }

        PresenceBroadcast status(PresenceStatus status, String message, boolean sharing) {
            return factory.status(new StatusPayload(status, message, null, "Ana", "#ff8800", sharing));
        }

        PresenceBroadcast signed(BroadcastType type, BroadcastPayload payload, long sequence) {
            var unsigned = new PresenceBroadcast(id(), type, payload, null, clock.millis(), sequence, 60);
            return new PresenceBroadcast(id(), type, payload, signer.sign(codec.signingBytes(unsigned)),
                unsigned.timestamp(), sequence, 60);
        }
    }
}

package com.presencelite;

import com.presencelite.broadcast.BroadcastCodec;
import com.presencelite.channel.LocalPresenceBus;
import com.presencelite.channel.PresenceChannel;
import com.presencelite.channel.PresenceTransport;
import com.presencelite.config.PresenceConfigLoader;
import com.presencelite.crypto.Ed25519Signer;
import com.presencelite.crypto.Identities;
import com.presencelite.engine.PresenceConfig;
import com.presencelite.engine.PresenceManager;
import com.presencelite.geo.GeoMath;
import com.presencelite.geo.HsrGeohashCodec;
import com.presencelite.geolocation.SimulatedGeolocationSource;
import com.presencelite.metrics.PresenceStatusServer;
import com.presencelite.model.GeoPoint;
import com.presencelite.model.TrustTier;
import com.presencelite.transport.kafka.KafkaPresenceTransport;
import com.presencelite.transport.kafka.PresenceTopicAdmin;
import com.presencelite.trust.InMemoryTrustCircleStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;

/**
 * Runs one presence node.
 *
 * Startup sequence:
 *   1. Resolve configuration (classpath, optional file argument, env, system properties)
 *   2. Load the Ed25519 identity from its key file, creating it on first start
 *   3. Connect the transport: Kafka (topic created if missing) or an in-process bus
 *      with a simulated companion peer
 *   4. Start the status server
 *   5. Join the channel and share a simulated location, tracked or captured once
 *   6. Block until shutdown signal
 */
public class PresenceNodeApplication {

    private static final Logger log = LoggerFactory.getLogger(PresenceNodeApplication.class);

    public static void main(String[] args) throws Exception {
        var props = PresenceConfigLoader.load(args.length > 0 ? Path.of(args[0]) : null);
        var config = PresenceConfigLoader.presenceConfig(props);
        var clock = Clock.systemUTC();
        var geohashCodec = new HsrGeohashCodec();
        var codec = new BroadcastCodec(geohashCodec);

        var signer = PresenceConfigLoader.identity(props);
        log.info("=== presence node '{}' in channel '{}' ===", Identities.shorten(signer.identity()), config.channelId());
        log.info("Identity: {}", signer.identity());

        double startLat = PresenceConfigLoader.doubleValue(props, PresenceConfigLoader.SIM_LATITUDE, 37.7749);
        double startLng = PresenceConfigLoader.doubleValue(props, PresenceConfigLoader.SIM_LONGITUDE, -122.4194);
        long simInterval = PresenceConfigLoader.longValue(props, PresenceConfigLoader.SIM_INTERVAL_MS, 2_000);
        long seed = PresenceConfigLoader.longValue(props, PresenceConfigLoader.SIM_SEED, System.nanoTime());
        var geolocation = new SimulatedGeolocationSource(startLat, startLng, simInterval, seed, clock);
        geolocation.setPermissionGranted(
            Boolean.parseBoolean(props.getProperty(PresenceConfigLoader.SIM_PERMISSION_GRANTED, "true").trim()));

        var closeables = new ArrayList<AutoCloseable>();
        String kind = props.getProperty(PresenceConfigLoader.TRANSPORT, "kafka").trim();
        LocalPresenceBus bus = "local".equals(kind) ? new LocalPresenceBus() : null;
        PresenceTransport transport = bus != null ? bus.connect() : kafkaTransport(props, config, kind);

        var manager = PresenceManager.builder(config, signer)
            .geohashCodec(geohashCodec)
            .trustStore(new InMemoryTrustCircleStore(PresenceConfigLoader.trustEntries(props)))
            .geolocation(geolocation)
            .clock(clock)
            .build();
        manager.on(event -> log.info("[{}] {}", event.type(), event));

        int statusPort = PresenceConfigLoader.intValue(props, PresenceConfigLoader.STATUS_PORT, 8080);
        var statusServer = new PresenceStatusServer(statusPort, manager);
        statusServer.start();

        var channel = new PresenceChannel(manager, transport, codec);
        channel.connect();
        String locationMode = props.getProperty(PresenceConfigLoader.LOCATION_MODE, "watch").trim();
        switch (locationMode) {
            case "watch" -> channel.startSharing();
            case "once" -> channel.locateOnce();
            default -> throw new IllegalStateException(
                PresenceConfigLoader.LOCATION_MODE + " must be 'watch' or 'once', got '" + locationMode + "'");
        }

        if (bus != null) {
            startCompanion(config, signer.identity(), bus, codec, clock, startLat, startLng, closeables);
            closeables.add(bus);
        }

        var latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown signal received");
            channel.close();
            geolocation.close();
            transport.close();
            closeAll(closeables);
            statusServer.stop();
            latch.countDown();
        }, "presence-shutdown"));

        log.info("Node running. Status: http://localhost:{}/views", statusServer.port());
        log.info("Press Ctrl+C to stop.");
        latch.await();
        log.info("Presence node shutdown complete.");
    }

    private static PresenceTransport kafkaTransport(Properties props, PresenceConfig config, String kind) {
        if (!"kafka".equals(kind)) {
            throw new IllegalStateException(PresenceConfigLoader.TRANSPORT + " must be 'kafka' or 'local', got '" + kind + "'");
        }
        var kafka = PresenceConfigLoader.kafkaConfig(props);
        PresenceTopicAdmin.ensureTopic(kafka, config.channelId());
        return KafkaPresenceTransport.create(kafka, config.channelId(), UUID.randomUUID().toString());
    }

    /**
     * Second node on the in-process bus so a local run has someone to see.
     * It trusts the main node as a friend.
     */
    private static void startCompanion(PresenceConfig config, String mainIdentity, LocalPresenceBus bus,
                                       BroadcastCodec codec, Clock clock, double lat, double lng,
                                       List<AutoCloseable> closeables) {
        var companionConfig = PresenceConfig.builder(config.channelId())
            .displayName("companion")
            .updateIntervalMs(config.updateIntervalMs())
            .presenceTtlSeconds(config.presenceTtlSeconds())
            .build();
        var start = GeoMath.offsetNorth(new GeoPoint(lat, lng), 250);
        var geolocation = new SimulatedGeolocationSource(start.latitude(), start.longitude(), 3_000, 7L, clock);
        var manager = PresenceManager.builder(companionConfig, Ed25519Signer.generate())
            .geolocation(geolocation)
            .clock(clock)
            .build();
        manager.setTrustLevel(mainIdentity, TrustTier.FRIENDS);
        var channel = new PresenceChannel(manager, bus.connect(), codec);
        channel.connect();
        channel.startSharing();
        closeables.add(channel);
        closeables.add(geolocation);
        log.info("Companion {} joined the local bus", Identities.shorten(manager.identity()));
    }

    private static void closeAll(List<AutoCloseable> closeables) {
        for (var closeable : closeables) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close {}: {}", closeable, e.getMessage());
            }
        }
    }
}

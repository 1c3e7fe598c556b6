package com.presencelite.geolocation;

import com.presencelite.model.Coordinates;
import com.presencelite.model.LocationSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Random-walk position source for running a node without a device. Each
 * tick moves the walker along its heading at a walking pace and turns it by
 * a few degrees. Seeded, so two sources with the same seed walk the same path.
 */
public class SimulatedGeolocationSource implements GeolocationSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SimulatedGeolocationSource.class);

    private static final double METERS_PER_DEGREE_LAT = 111_320.0;
    private static final double MIN_SPEED_MPS = 0.8;
    private static final double MAX_SPEED_MPS = 1.8;
    private static final double MAX_TURN_DEGREES = 25.0;

    private final Clock clock;
    private final Random random;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler;
    private final Map<Long, ScheduledFuture<?>> watches = new ConcurrentHashMap<>();
    private final AtomicLong nextWatchId = new AtomicLong();

    private volatile boolean permissionGranted = true;
    private double latitude;
    private double longitude;
    private double heading;
    private double speed;

    public SimulatedGeolocationSource(double startLatitude, double startLongitude, long intervalMs, long seed, Clock clock) {
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive, got " + intervalMs);
        }
        // Validates the start point
        Coordinates.of(startLatitude, startLongitude);
        this.latitude = startLatitude;
        this.longitude = startLongitude;
        this.intervalMs = intervalMs;
        this.clock = clock;
        this.random = new Random(seed);
        this.heading = random.nextInt(360);
        this.speed = MIN_SPEED_MPS + random.nextDouble() * (MAX_SPEED_MPS - MIN_SPEED_MPS);
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var thread = new Thread(r, "simulated-geolocation");
            thread.setDaemon(true);
            return thread;
        });
    }

    /** Simulates the user revoking or granting location permission. */
    public void setPermissionGranted(boolean granted) {
        this.permissionGranted = granted;
    }

    @Override
    public WatchHandle watch(Consumer<GeoFix> onFix, Consumer<LocationError> onError) throws GeolocationException {
        if (!permissionGranted) {
            throw new GeolocationException(LocationError.permissionDenied("Location permission denied"));
        }
        var handle = new WatchHandle(nextWatchId.incrementAndGet());
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> tick(onFix, onError), 0, intervalMs, TimeUnit.MILLISECONDS);
        watches.put(handle.id(), future);
        log.info("Started simulated watch {} every {}ms", handle.id(), intervalMs);
        return handle;
    }

    @Override
    public void clearWatch(WatchHandle handle) {
        if (handle == null) {
            return;
        }
        var future = watches.remove(handle.id());
        if (future != null) {
            future.cancel(false);
            log.info("Cleared simulated watch {}", handle.id());
        }
    }

    @Override
    public void getCurrentFix(Consumer<GeoFix> onFix, Consumer<LocationError> onError) {
        if (!permissionGranted) {
            onError.accept(LocationError.permissionDenied("Location permission denied"));
            return;
        }
        onFix.accept(currentFix());
    }

    /**
     * Advances the walk by one interval and returns the new fix.
     */
    public synchronized GeoFix step() {
        double seconds = intervalMs / 1000.0;
        double distance = speed * seconds;
        double rad = Math.toRadians(heading);
        double dLat = distance * Math.cos(rad) / METERS_PER_DEGREE_LAT;
        double dLng = distance * Math.sin(rad) / (METERS_PER_DEGREE_LAT * Math.cos(Math.toRadians(latitude)));
        latitude = Math.max(-89.9, Math.min(89.9, latitude + dLat));
        longitude = wrapLongitude(longitude + dLng);
        heading = (heading + (random.nextDouble() * 2 - 1) * MAX_TURN_DEGREES + 360) % 360;
        return currentFix();
    }

    private synchronized GeoFix currentFix() {
        var coordinates = new Coordinates(latitude, longitude, null, 5.0, heading, speed);
        return new GeoFix(coordinates, LocationSource.GPS, clock.millis());
    }

    private void tick(Consumer<GeoFix> onFix, Consumer<LocationError> onError) {
        try {
            if (!permissionGranted) {
                onError.accept(LocationError.permissionDenied("Location permission revoked"));
                return;
            }
            onFix.accept(step());
        } catch (RuntimeException e) {
            // Keep the schedule alive; a thrown exception would cancel it
            log.warn("Simulated fix delivery failed: {}", e.getMessage(), e);
        }
    }

    private static double wrapLongitude(double lng) {
        if (lng > 180) return lng - 360;
        if (lng < -180) return lng + 360;
        return lng;
    }

    @Override
    public void close() {
        watches.values().forEach(f -> f.cancel(false));
        watches.clear();
        scheduler.shutdownNow();
    }
}

package com.presencelite.broadcast;

import com.presencelite.crypto.Signer;
import com.presencelite.model.LocationCommitment;
import com.presencelite.model.SpeedCategory;
import com.presencelite.model.TrustTier;
import com.presencelite.policy.PrecisionPolicy;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Builds signed broadcasts for one sender and owns its sequence counter.
 */
public class BroadcastFactory {

    private final Signer signer;
    private final BroadcastCodec codec;
    private final Clock clock;
    private final int ttlSeconds;
    private final AtomicLong sequence = new AtomicLong();

    public BroadcastFactory(Signer signer, BroadcastCodec codec, Clock clock, int ttlSeconds) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive, got " + ttlSeconds);
        }
        this.signer = signer;
        this.codec = codec;
        this.clock = clock;
        this.ttlSeconds = ttlSeconds;
    }

    /**
     * @param publicPrecision characters published for the public tier; clamped
     *                        so it never exceeds the policy precision
     */
    public PresenceBroadcast location(LocationCommitment commitment,
                                      boolean moving,
                                      Double heading,
                                      SpeedCategory speedCategory,
                                      int publicPrecision) {
        var payload = new LocationPayload(
            commitment.published(),
            precisionLevels(commitment.fullGeohash(), publicPrecision),
            moving,
            heading,
            speedCategory);
        return sign(BroadcastType.LOCATION, payload);
    }

    public PresenceBroadcast status(StatusPayload payload) {
        return sign(BroadcastType.STATUS, payload);
    }

    public PresenceBroadcast proximity(ProximityPayload payload) {
        return sign(BroadcastType.PROXIMITY, payload);
    }

    public PresenceBroadcast leave() {
        return sign(BroadcastType.LEAVE, null);
    }

    /**
     * Truncates {@code fullGeohash} once per tier.
     */
    public static List<PrecisionLevel> precisionLevels(String fullGeohash, int publicPrecision) {
        var levels = new ArrayList<PrecisionLevel>(TrustTier.values().length);
        for (var tier : TrustTier.values()) {
            int precision = PrecisionPolicy.precisionFor(tier);
            if (tier == TrustTier.PUBLIC) {
                precision = Math.max(PrecisionPolicy.MIN_PRECISION, Math.min(precision, publicPrecision));
            }
            precision = Math.min(precision, fullGeohash.length());
            levels.add(new PrecisionLevel(tier, fullGeohash.substring(0, precision), precision));
        }
        return levels;
    }

    private PresenceBroadcast sign(BroadcastType type, BroadcastPayload payload) {
        var unsigned = new PresenceBroadcast(
            signer.identity(),
            type,
            payload,
            null,
            clock.millis(),
            sequence.incrementAndGet(),
            ttlSeconds);
        String signature = signer.sign(codec.signingBytes(unsigned));
        return new PresenceBroadcast(
            unsigned.senderIdentity(),
            unsigned.type(),
            unsigned.payload(),
            signature,
            unsigned.timestamp(),
            unsigned.sequence(),
            unsigned.ttlSeconds());
    }
}

package com.presencelite.engine;

import com.presencelite.broadcast.LocationPayload;
import com.presencelite.broadcast.PrecisionLevel;
import com.presencelite.geo.GeohashCodec;
import com.presencelite.model.LocationFix;
import com.presencelite.model.PresenceView;
import com.presencelite.model.TrustTier;
import com.presencelite.model.ViewableLocation;
import com.presencelite.policy.PrecisionPolicy;

import java.util.List;

/**
 * Turns what a peer broadcast into what the local user may see of it. The
 * receiver enforces its own policy: whatever levels the sender included, the
 * projected geohash is never longer than {@code precisionFor(localTier)}.
 */
public class PresenceViewProjector {

    private final GeohashCodec codec;

    public PresenceViewProjector(GeohashCodec codec) {
        this.codec = codec;
    }

    PresenceView project(PeerState peer, TrustTier tier, LocationFix self, long now) {
        var presence = peer.presence;
        ViewableLocation location = peer.location == null ? null : viewable(peer.location, tier, now);
        var proximity = peer.reportedProximity != null && location != null
            ? peer.reportedProximity
            : ProximityCalculator.compute(self, location);
        return new PresenceView(
            presence.identity(),
            presence.displayName(),
            presence.color(),
            location,
            presence.status(),
            presence.lastSeen(),
            tier,
            peer.commitmentVerified,
            proximity);
    }

    /**
     * Location at the precision {@code tier} is entitled to, or null when the
     * payload carries no usable level.
     */
    public ViewableLocation viewable(LocationPayload payload, TrustTier tier, long now) {
        int allowed = PrecisionPolicy.precisionFor(tier);
        var level = selectLevel(payload.precisionLevels(), tier, allowed);
        if (level == null) {
            return null;
        }
        int precision = Math.min(Math.min(level.precision(), allowed), level.geohash().length());
        String geohash = level.geohash().substring(0, precision);
        var bounds = codec.bounds(geohash);
        double ageSeconds = Math.max(0, now - payload.commitment().timestamp()) / 1000.0;
        return new ViewableLocation(
            geohash,
            precision,
            bounds.center(),
            bounds,
            PrecisionPolicy.radiusForPrecision(precision),
            ageSeconds,
            payload.moving(),
            payload.heading(),
            payload.speedCategory());
    }

    /**
     * The level labelled for {@code tier}; failing that the finest level within
     * {@code allowed}; failing that the coarsest level, to be truncated.
     */
    static PrecisionLevel selectLevel(List<PrecisionLevel> levels, TrustTier tier, int allowed) {
        PrecisionLevel bestWithin = null;
        PrecisionLevel coarsest = null;
        for (var level : levels) {
            if (level.trustTier() == tier) {
                return level;
            }
            if (level.precision() <= allowed && (bestWithin == null || level.precision() > bestWithin.precision())) {
                bestWithin = level;
            }
            if (coarsest == null || level.precision() < coarsest.precision()) {
                coarsest = level;
            }
        }
        return bestWithin != null ? bestWithin : coarsest;
    }
}

package com.presencelite.policy;

import com.presencelite.model.TrustTier;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed tables mapping trust tiers to geohash precision and precision to an
 * uncertainty radius. Fewer characters mean a larger, vaguer cell.
 */
public final class PrecisionPolicy {

    public static final int MIN_PRECISION = 1;
    public static final int MAX_PRECISION = 12;

    private static final Map<TrustTier, Integer> TIER_PRECISION = new EnumMap<>(Map.of(
        TrustTier.INTIMATE, 9,   // ~2.4m
        TrustTier.CLOSE,    7,   // ~76m, block level
        TrustTier.FRIENDS,  5,   // ~2.4km, neighbourhood
        TrustTier.NETWORK,  4,   // ~20km, city area
        TrustTier.PUBLIC,   2    // ~630km, region only
    ));

    // Index = precision - 1, metres
    private static final double[] RADIUS_METERS = {
        2_500_000,
        630_000,
        78_000,
        20_000,
        2_400,
        610,
        76,
        19,
        2.4,
        0.6,
        0.074,
        0.019
    };

    private PrecisionPolicy() {
    }

    public static int precisionFor(TrustTier tier) {
        return TIER_PRECISION.get(tier);
    }

    public static double radiusForPrecision(int precision) {
        return RADIUS_METERS[clamp(precision) - 1];
    }

    public static int clamp(int precision) {
        return Math.max(MIN_PRECISION, Math.min(MAX_PRECISION, precision));
    }
}

package com.presencelite.broadcast;

import com.presencelite.model.TrustTier;

/**
 * The sender's geohash truncated for one trust tier.
 */
public record PrecisionLevel(TrustTier trustTier, String geohash, int precision) {
}

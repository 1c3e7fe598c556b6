package com.presencelite.geo;

import com.presencelite.model.GeoBounds;
import com.presencelite.model.GeoPoint;

/**
 * Base-32 geohash encoding. Implementations must be deterministic and pure.
 */
public interface GeohashCodec {

    String ALPHABET = "0123456789bcdefghjkmnpqrstuvwxyz";

    String encode(double latitude, double longitude, int precision);

    /** Centre of the cell. */
    GeoPoint decode(String geohash);

    GeoBounds bounds(String geohash);

    /**
     * True when {@code geohash} is 1 to 12 characters of the geohash alphabet.
     */
    default boolean isValid(String geohash) {
        if (geohash == null || geohash.isEmpty() || geohash.length() > 12) {
            return false;
        }
        for (int i = 0; i < geohash.length(); i++) {
            if (ALPHABET.indexOf(geohash.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}

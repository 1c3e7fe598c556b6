package com.presencelite.geo;

import ch.hsr.geohash.BoundingBox;
import ch.hsr.geohash.GeoHash;
import com.presencelite.model.GeoBounds;
import com.presencelite.model.GeoPoint;
import com.presencelite.policy.PrecisionPolicy;

/**
 * {@link GeohashCodec} backed by the {@code ch.hsr.geohash} library.
 */
public class HsrGeohashCodec implements GeohashCodec {

    @Override
    public String encode(double latitude, double longitude, int precision) {
        if (precision < PrecisionPolicy.MIN_PRECISION || precision > PrecisionPolicy.MAX_PRECISION) {
            throw new IllegalArgumentException("Precision must be between 1 and 12, got " + precision);
        }
        return GeoHash.withCharacterPrecision(latitude, longitude, precision).toBase32();
    }

    @Override
    public GeoPoint decode(String geohash) {
        return bounds(geohash).center();
    }

    @Override
    public GeoBounds bounds(String geohash) {
        if (!isValid(geohash)) {
            throw new IllegalArgumentException("Invalid geohash: " + geohash);
        }
        BoundingBox box = GeoHash.fromGeohashString(geohash).getBoundingBox();
        return new GeoBounds(
            box.getSouthLatitude(),
            box.getNorthLatitude(),
            box.getWestLongitude(),
            box.getEastLongitude()
        );
    }
}

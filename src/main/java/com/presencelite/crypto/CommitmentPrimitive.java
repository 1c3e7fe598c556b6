package com.presencelite.crypto;

import com.presencelite.model.Commitment;
import com.presencelite.model.LocationCommitment;

/**
 * Binds an identity to a full-precision geohash at a point in time without
 * revealing the geohash.
 */
public interface CommitmentPrimitive {

    /**
     * Deterministic for identical inputs except for the timestamp.
     */
    LocationCommitment create(double latitude, double longitude, int precision, Signer signer);

    /** True when {@code commitment} was signed by {@code identity}. */
    boolean verify(Commitment commitment, String identity, Verifier verifier);

    /** True when {@code geohash} and {@code salt} open {@code commitment}. */
    boolean opens(Commitment commitment, String geohash, String salt);
}

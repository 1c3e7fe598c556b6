package com.presencelite.crypto;

import com.presencelite.geo.GeohashCodec;
import com.presencelite.model.Commitment;
import com.presencelite.model.LocationCommitment;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.HexFormat;

/**
 * SHA-256 commitment over {@code geohash|salt}. The salt is derived from the
 * signer's own signature of the geohash: Ed25519 signatures are
 * deterministic, so the same signer and cell always produce the same salt,
 * and nobody without the private key can compute it.
 */
public class HashCommitmentPrimitive implements CommitmentPrimitive {

    private final GeohashCodec codec;
    private final Clock clock;

    public HashCommitmentPrimitive(GeohashCodec codec, Clock clock) {
        this.codec = codec;
        this.clock = clock;
    }

    @Override
    public LocationCommitment create(double latitude, double longitude, int precision, Signer signer) {
        String geohash = codec.encode(latitude, longitude, precision);
        String salt = sha256Hex(signer.sign(utf8("salt|" + geohash)));
        String digest = sha256Hex(geohash + "|" + salt);
        long timestamp = clock.millis();
        String signature = signer.sign(signedContent(digest, timestamp));
        return new LocationCommitment(geohash, salt, new Commitment(digest, signature, timestamp));
    }

    @Override
    public boolean verify(Commitment commitment, String identity, Verifier verifier) {
        if (commitment == null || commitment.digest() == null) {
            return false;
        }
        return verifier.verify(identity, signedContent(commitment.digest(), commitment.timestamp()), commitment.signature());
    }

    @Override
    public boolean opens(Commitment commitment, String geohash, String salt) {
        return MessageDigest.isEqual(
            utf8(sha256Hex(geohash + "|" + salt)),
            utf8(commitment.digest()));
    }

    private static byte[] signedContent(String digest, long timestamp) {
        return utf8(digest + "|" + timestamp);
    }

    private static String sha256Hex(String input) {
        try {
            var digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(utf8(input)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}

package com.presencelite.model;

/**
 * Wire form of a location commitment: a salted digest of the full-precision
 * geohash, signed by its owner. Reveals nothing about the cell by itself.
 *
 * @param digest    hex SHA-256 of {@code fullGeohash|salt}
 * @param signature signer's signature over {@code digest|timestamp}
 * @param timestamp epoch millis at creation
 */
public record Commitment(String digest, String signature, long timestamp) {
}

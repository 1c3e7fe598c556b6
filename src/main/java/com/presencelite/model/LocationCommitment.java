package com.presencelite.model;

/**
 * Local side of a commitment. {@code fullGeohash} and {@code salt} never leave
 * the process; only {@link #published()} is broadcast.
 */
public record LocationCommitment(String fullGeohash, String salt, Commitment published) {

    public long timestamp() {
        return published.timestamp();
    }

    @Override
    public String toString() {
        return "LocationCommitment[digest=" + published.digest() + "]";
    }
}

package com.presencelite.broadcast;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Signed envelope exchanged between peers. Receivers derive state from it
 * and never modify it.
 *
 * @param timestamp  epoch millis at the sender
 * @param sequence   strictly increasing per sender
 * @param ttlSeconds age after which receivers discard the broadcast
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PresenceBroadcast(
    String senderIdentity,
    BroadcastType type,
    BroadcastPayload payload,
    String signature,
    long timestamp,
    long sequence,
    int ttlSeconds
) {
    public boolean isExpiredAt(long nowMillis) {
        return nowMillis - timestamp > ttlSeconds * 1000L;
    }

    public long expiresAt() {
        return timestamp + ttlSeconds * 1000L;
    }
}

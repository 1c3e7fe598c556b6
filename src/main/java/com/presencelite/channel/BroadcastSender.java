package com.presencelite.channel;

/**
 * Outbound half of a transport. Hands the bytes off and returns; delivery is
 * not awaited.
 */
@FunctionalInterface
public interface BroadcastSender {

    void send(byte[] broadcast) throws TransportException;
}

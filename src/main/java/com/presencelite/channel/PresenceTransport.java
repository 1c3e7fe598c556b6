package com.presencelite.channel;

import com.presencelite.engine.Subscription;

import java.util.function.Consumer;

/**
 * Carries encoded broadcasts between the nodes of one channel. Implementations
 * may deliver a node's own broadcasts back to it.
 */
public interface PresenceTransport extends BroadcastSender, AutoCloseable {

    /**
     * Registers a receiver for incoming broadcasts. Delivery happens on a
     * transport-owned thread.
     */
    Subscription subscribe(Consumer<byte[]> receiver);

    @Override
    void close();
}

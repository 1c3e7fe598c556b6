package com.presencelite.channel;

import com.presencelite.engine.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;

/**
 * In-process channel: every connected transport receives every broadcast,
 * its own included. Delivery runs on the bus executor, so a sender never
 * holds its own lock while a receiver runs.
 */
public class LocalPresenceBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LocalPresenceBus.class);

    private final List<Consumer<byte[]>> receivers = new CopyOnWriteArrayList<>();
    private final Executor delivery;
    private final ExecutorService ownedExecutor;

    public LocalPresenceBus() {
        this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "local-presence-bus");
            thread.setDaemon(true);
            return thread;
        });
        this.delivery = ownedExecutor;
    }

    /**
     * @param delivery runs each delivery; {@code Runnable::run} delivers on the
     *                 sending thread
     */
    public LocalPresenceBus(Executor delivery) {
        this.delivery = delivery;
        this.ownedExecutor = null;
    }

    /** A new endpoint on this bus. */
    public PresenceTransport connect() {
        return new Endpoint();
    }

    private void publish(byte[] bytes) {
        for (var receiver : receivers) {
            delivery.execute(() -> {
                try {
                    receiver.accept(bytes);
                } catch (RuntimeException e) {
                    log.error("Local presence receiver failed", e);
                }
            });
        }
    }

    @Override
    public void close() {
        receivers.clear();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
    }

    private final class Endpoint implements PresenceTransport {

        private final List<Consumer<byte[]>> own = new CopyOnWriteArrayList<>();
        private volatile boolean closed;

        @Override
        public void send(byte[] broadcast) throws TransportException {
            if (closed) {
                throw new TransportException("Local transport is closed");
            }
            publish(broadcast);
        }

        @Override
        public Subscription subscribe(Consumer<byte[]> receiver) {
            receivers.add(receiver);
            own.add(receiver);
            return () -> {
                receivers.remove(receiver);
                own.remove(receiver);
            };
        }

        @Override
        public void close() {
            closed = true;
            receivers.removeAll(own);
            own.clear();
        }
    }
}

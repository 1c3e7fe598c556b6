package com.presencelite.engine;

/**
 * Handle returned when registering a listener. Closing it unregisters; closing
 * twice is harmless.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    @Override
    void close();
}

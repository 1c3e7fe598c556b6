package com.presencelite.engine;

import com.presencelite.metrics.PresenceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fan-out to registered listeners. A listener that throws is logged and
 * counted; the remaining listeners still receive the event.
 */
public class PresenceEventBus {

    private static final Logger log = LoggerFactory.getLogger(PresenceEventBus.class);

    private final List<PresenceEventListener> listeners = new CopyOnWriteArrayList<>();
    private final PresenceMetrics metrics;

    public PresenceEventBus(PresenceMetrics metrics) {
        this.metrics = metrics;
    }

    public Subscription subscribe(PresenceEventListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    public void publish(PresenceEvent event) {
        for (var listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                metrics.recordListenerError();
                log.error("Presence listener failed on {}", event.type(), e);
            }
        }
    }
}

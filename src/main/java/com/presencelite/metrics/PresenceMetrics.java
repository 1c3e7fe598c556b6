package com.presencelite.metrics;

import com.presencelite.engine.IngestResult;

import java.util.concurrent.atomic.LongAdder;

/**
 * Lock-free counters for one presence node. Written from the manager, the
 * transport poll thread and the scheduler; read by the status server.
 */
public class PresenceMetrics {

    private final LongAdder broadcastsSent     = new LongAdder();
    private final LongAdder sendFailures       = new LongAdder();
    private final LongAdder locationsThrottled = new LongAdder();
    private final LongAdder received           = new LongAdder();
    private final LongAdder applied            = new LongAdder();
    private final LongAdder ignoredSelf        = new LongAdder();
    private final LongAdder expired            = new LongAdder();
    private final LongAdder unverified         = new LongAdder();
    private final LongAdder staleSequence      = new LongAdder();
    private final LongAdder notApplicable      = new LongAdder();
    private final LongAdder malformed          = new LongAdder();
    private final LongAdder listenerErrors     = new LongAdder();
    private final LongAdder peersExpired       = new LongAdder();

    private final long startedAt = System.currentTimeMillis();

    public record Snapshot(
        long broadcastsSent,
        long sendFailures,
        long locationsThrottled,
        long received,
        long applied,
        long ignoredSelf,
        long expired,
        long unverified,
        long staleSequence,
        long notApplicable,
        long malformed,
        long listenerErrors,
        long peersExpired,
        long uptimeSeconds
    ) {
        public long dropped() {
            return expired + unverified + staleSequence + notApplicable + malformed;
        }
    }

    public void recordSent()              { broadcastsSent.increment(); }
    public void recordSendFailure()       { sendFailures.increment(); }
    public void recordThrottled()         { locationsThrottled.increment(); }
    public void recordMalformed()         { received.increment(); malformed.increment(); }
    public void recordListenerError()     { listenerErrors.increment(); }
    public void recordPeerExpired()       { peersExpired.increment(); }

    /** Counts one decoded broadcast by outcome. */
    public void recordIngest(IngestResult outcome) {
        received.increment();
        var counter = switch (outcome) {
            case APPLIED -> applied;
            case IGNORED_SELF -> ignoredSelf;
            case EXPIRED -> expired;
            case UNVERIFIED -> unverified;
            case STALE_SEQUENCE -> staleSequence;
            case NOT_APPLICABLE -> notApplicable;
            case MALFORMED -> malformed;
        };
        counter.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(
            broadcastsSent.sum(),
            sendFailures.sum(),
            locationsThrottled.sum(),
            received.sum(),
            applied.sum(),
            ignoredSelf.sum(),
            expired.sum(),
            unverified.sum(),
            staleSequence.sum(),
            notApplicable.sum(),
            malformed.sum(),
            listenerErrors.sum(),
            peersExpired.sum(),
            (System.currentTimeMillis() - startedAt) / 1000);
    }

    public String toJson() {
        var s = snapshot();
        return String.format("""
                {
                  "broadcasts_sent": %d,
                  "send_failures": %d,
                  "locations_throttled": %d,
                  "received": %d,
                  "applied": %d,
                  "ignored_self": %d,
                  "expired": %d,
                  "unverified": %d,
                  "stale_sequence": %d,
                  "not_applicable": %d,
                  "malformed": %d,
                  "listener_errors": %d,
                  "peers_expired": %d,
                  "uptime_seconds": %d
                }""",
                s.broadcastsSent(), s.sendFailures(), s.locationsThrottled(),
                s.received(), s.applied(), s.ignoredSelf(), s.expired(),
                s.unverified(), s.staleSequence(), s.notApplicable(), s.malformed(),
                s.listenerErrors(), s.peersExpired(), s.uptimeSeconds());
    }
}

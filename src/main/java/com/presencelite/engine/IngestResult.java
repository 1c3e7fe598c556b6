package com.presencelite.engine;

/**
 * Outcome of {@link PresenceManager#handleBroadcast}. Only {@link #APPLIED}
 * changes state.
 */
public enum IngestResult {
    APPLIED,
    /** Our own broadcast echoed back by the transport. */
    IGNORED_SELF,
    /** Older than its own TTL. */
    EXPIRED,
    /** Signature does not verify against the sender identity. */
    UNVERIFIED,
    /** Sequence at or below the last one applied for the sender. */
    STALE_SEQUENCE,
    /** Proximity aimed at someone else, or from a peer we have no view of. */
    NOT_APPLICABLE,
    /** Fails structural validation, e.g. a payload that does not match its type. */
    MALFORMED
}

package com.presencelite.broadcast;

/**
 * Bytes that do not decode to a well-formed {@link PresenceBroadcast}.
 * Receivers drop such input and count it; it is never escalated.
 */
public class MalformedBroadcastException extends Exception {

    public MalformedBroadcastException(String message) {
        super(message);
    }

    public MalformedBroadcastException(String message, Throwable cause) {
        super(message, cause);
    }
}

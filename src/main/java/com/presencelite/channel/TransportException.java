package com.presencelite.channel;

/**
 * An encoded broadcast could not be handed to the transport.
 */
public class TransportException extends Exception {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}

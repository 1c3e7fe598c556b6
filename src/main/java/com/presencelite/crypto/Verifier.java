package com.presencelite.crypto;

/**
 * Checks signatures produced by a {@link Signer}. Never throws on bad input:
 * anything that cannot be verified is simply not valid.
 */
public interface Verifier {

    boolean verify(String identity, byte[] message, String signature);
}

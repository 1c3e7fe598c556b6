package com.presencelite.crypto;

/**
 * Signs outgoing presence data on behalf of one identity.
 */
public interface Signer {

    /** Identity peers verify against; for Ed25519 the encoded public key. */
    String identity();

    /** Base64 signature over {@code message}. */
    String sign(byte[] message);
}

package com.presencelite.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.Signature;
import java.util.Base64;

/**
 * Ed25519 signer from the JDK provider. The identity is the Base64url form of
 * the X.509-encoded public key, so any peer can verify without a key directory.
 */
public class Ed25519Signer implements Signer {

    static final String ALGORITHM = "Ed25519";

    private final PrivateKey privateKey;
    private final String identity;

    public Ed25519Signer(KeyPair keyPair) {
        this.privateKey = keyPair.getPrivate();
        this.identity = Identities.encode(keyPair.getPublic());
    }

    public static Ed25519Signer generate() {
        return new Ed25519Signer(generateKeyPair());
    }

    public static KeyPair generateKeyPair() {
        try {
            return KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Ed25519 not available in this JDK", e);
        }
    }

    @Override
    public String identity() {
        return identity;
    }

    @Override
    public String sign(byte[] message) {
        try {
            // Signature instances are not thread-safe
            var signature = Signature.getInstance(ALGORITHM);
            signature.initSign(privateKey);
            signature.update(message);
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign presence data", e);
        }
    }
}

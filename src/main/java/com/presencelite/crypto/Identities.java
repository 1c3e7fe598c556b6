package com.presencelite.crypto;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Conversions between public keys and identity strings.
 */
public final class Identities {

    private Identities() {
    }

    public static String encode(PublicKey key) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(key.getEncoded());
    }

    /**
     * @throws IllegalArgumentException when {@code identity} is not an encoded Ed25519 key
     */
    public static PublicKey decode(String identity) {
        try {
            byte[] encoded = Base64.getUrlDecoder().decode(identity);
            return KeyFactory.getInstance(Ed25519Signer.ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("Not an Ed25519 identity: " + shorten(identity), e);
        }
    }

    /** Short form for logs and default display names. */
    public static String shorten(String identity) {
        if (identity == null) return "null";
        // X.509 prefix is identical for every Ed25519 key, so take the tail
        return identity.length() <= 8 ? identity : identity.substring(identity.length() - 8);
    }
}

package com.presencelite.crypto;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.Signature;
import java.util.Base64;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class Ed25519Verifier implements Verifier {

    private static final Logger log = LoggerFactory.getLogger(Ed25519Verifier.class);

    private static final int MAX_CACHED_KEYS = 4_096;

    // Decoding an X.509 key is not free; peers re-broadcast every few seconds
    private final Map<String, PublicKey> keyCache = new ConcurrentHashMap<>();

    @Override
    public boolean verify(String identity, byte[] message, String signature) {
        if (identity == null || message == null || signature == null) {
            return false;
        }
        try {
            if (keyCache.size() >= MAX_CACHED_KEYS) {
                keyCache.clear();
            }
            PublicKey key = keyCache.computeIfAbsent(identity, Identities::decode);
            var verifier = Signature.getInstance(Ed25519Signer.ALGORITHM);
            verifier.initVerify(key);
            verifier.update(message);
            return verifier.verify(Base64.getDecoder().decode(signature));
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature check failed for {}: {}", Identities.shorten(identity), e.getMessage());
            return false;
        }
    }
}

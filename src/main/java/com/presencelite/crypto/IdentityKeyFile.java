package com.presencelite.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

/**
 * Keeps a node's Ed25519 key pair in a small JSON file so its identity
 * survives restarts. Keys are stored in their standard encodings: X.509 for
 * the public key and PKCS#8 for the private key, both Base64.
 */
public final class IdentityKeyFile {

    private static final Logger log = LoggerFactory.getLogger(IdentityKeyFile.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final byte[] SELF_CHECK = "presence-identity-check".getBytes(StandardCharsets.UTF_8);

    record StoredKeyPair(String algorithm, String publicKey, String privateKey) {
    }

    private IdentityKeyFile() {
    }

    /**
     * Reads the key pair at {@code file}, or generates one and writes it there
     * when the file does not exist yet.
     *
     * @throws IllegalStateException when the file exists but does not hold a usable Ed25519 key pair
     * @throws UncheckedIOException when the file cannot be read or written
     */
    public static Ed25519Signer loadOrCreate(Path file) {
        if (Files.exists(file)) {
            var signer = new Ed25519Signer(read(file));
            log.info("Loaded identity {} from {}", Identities.shorten(signer.identity()), file);
            return signer;
        }
        var keyPair = Ed25519Signer.generateKeyPair();
        write(file, keyPair);
        var signer = new Ed25519Signer(keyPair);
        log.info("Generated identity {} and saved it to {}", Identities.shorten(signer.identity()), file);
        return signer;
    }

    static KeyPair read(Path file) {
        StoredKeyPair stored;
        try {
            stored = MAPPER.readValue(file.toFile(), StoredKeyPair.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read identity key file " + file, e);
        }
        if (stored.publicKey() == null || stored.privateKey() == null
            || !Ed25519Signer.ALGORITHM.equals(stored.algorithm())) {
            throw new IllegalStateException("Identity key file " + file + " does not hold an Ed25519 key pair");
        }
        KeyPair keyPair;
        try {
            var factory = KeyFactory.getInstance(Ed25519Signer.ALGORITHM);
            var publicKey = factory.generatePublic(new X509EncodedKeySpec(Base64.getDecoder().decode(stored.publicKey())));
            var privateKey = factory.generatePrivate(new PKCS8EncodedKeySpec(Base64.getDecoder().decode(stored.privateKey())));
            keyPair = new KeyPair(publicKey, privateKey);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            throw new IllegalStateException("Identity key file " + file + " holds an undecodable key", e);
        }
        // Public and private halves must belong together
        var signer = new Ed25519Signer(keyPair);
        if (!new Ed25519Verifier().verify(signer.identity(), SELF_CHECK, signer.sign(SELF_CHECK))) {
            throw new IllegalStateException("Identity key file " + file + " holds mismatched keys");
        }
        return keyPair;
    }

    static void write(Path file, KeyPair keyPair) {
        var stored = new StoredKeyPair(
            Ed25519Signer.ALGORITHM,
            Base64.getEncoder().encodeToString(keyPair.getPublic().getEncoded()),
            Base64.getEncoder().encodeToString(keyPair.getPrivate().getEncoded()));
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            MAPPER.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), stored);
            restrictToOwner(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write identity key file " + file, e);
        }
    }

    private static void restrictToOwner(Path file) throws IOException {
        try {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        } catch (UnsupportedOperationException e) {
            log.warn("Cannot restrict permissions on {}: file system is not POSIX", file);
        }
    }
}

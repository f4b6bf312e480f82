package com.questrail.fleet.credentials;

import javax.crypto.KeyGenerator;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.security.GeneralSecurityException;
import java.util.Base64;
import java.util.Objects;

/**
 * Supplies the AES key used to seal broker credentials at rest.
 *
 * <p>The key is never written next to the data it protects. It is either
 * generated per process ({@link #ephemeral()}), in which case persisted
 * credentials do not survive a restart, or handed in from an external key
 * service or environment secret ({@link #fromBase64(String)}).</p>
 */
public interface KeyProvider
{
    SecretKey key();

    static KeyProvider ephemeral() {
        try {
            KeyGenerator generator = KeyGenerator.getInstance("AES");
            generator.init(256);
            SecretKey key = generator.generateKey();
            return () -> key;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("AES key generation unavailable", e);
        }
    }

    static KeyProvider of(byte[] rawKey) {
        Objects.requireNonNull(rawKey, "rawKey");
        if (rawKey.length != 16 && rawKey.length != 24 && rawKey.length != 32) {
            throw new IllegalArgumentException("AES key must be 16, 24 or 32 bytes");
        }
        SecretKey key = new SecretKeySpec(rawKey.clone(), "AES");
        return () -> key;
    }

    static KeyProvider fromBase64(String encoded) {
        Objects.requireNonNull(encoded, "encoded");
        try {
            return of(Base64.getDecoder().decode(encoded.trim()));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("credential key is not valid base64 AES key material", e);
        }
    }
}

package com.questrail.fleet.credentials;

/**
 * On-disk form of the sealed broker configuration.
 *
 * @param formatVersion record layout version
 * @param algorithm     cipher transformation, e.g. {@code AES/GCM/NoPadding}
 * @param nonce         base64 GCM nonce, fresh for every write
 * @param ciphertext    base64 ciphertext with the GCM tag appended
 * @param updatedAt     ISO-8601 instant of the write
 */
public record EncryptedCredentialRecord(
        int formatVersion,
        String algorithm,
        String nonce,
        String ciphertext,
        String updatedAt
) {}

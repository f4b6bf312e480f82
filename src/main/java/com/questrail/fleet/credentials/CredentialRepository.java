package com.questrail.fleet.credentials;

import java.util.Optional;

/**
 * Byte-level storage of the sealed credential record.
 *
 * <p>Implementations see only ciphertext; they never need the key.</p>
 */
public interface CredentialRepository
{
    Optional<byte[]> read();

    void write(byte[] record);

    void delete();
}

package com.questrail.fleet.credentials;

import java.util.Optional;

/**
 * Credential repository held in memory; exposes the raw record so tests can
 * inspect or corrupt it.
 */
public final class InMemoryCredentialRepository implements CredentialRepository {

    private byte[] record;

    @Override
    public synchronized Optional<byte[]> read() {
        return Optional.ofNullable(record).map(byte[]::clone);
    }

    @Override
    public synchronized void write(byte[] record) {
        this.record = record.clone();
    }

    @Override
    public synchronized void delete() {
        record = null;
    }

    public synchronized byte[] raw() {
        return record;
    }
}

package com.questrail.fleet.credentials;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Keeps the sealed credential record in a single file.
 *
 * <p>Writes go to a sibling temporary file that is then moved over the
 * target, so a crash mid-write leaves either the old record or the new one.</p>
 */
public final class FileCredentialRepository implements CredentialRepository
{
    private final Path file;

    public FileCredentialRepository(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    @Override
    public Optional<byte[]> read() {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ConfigException("cannot read credential store " + file, e);
        }
    }

    @Override
    public void write(byte[] record) {
        Objects.requireNonNull(record, "record");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            Files.write(tmp, record);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new ConfigException("cannot write credential store " + file, e);
        }
    }

    @Override
    public void delete() {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new ConfigException("cannot delete credential store " + file, e);
        }
    }

    public Path file() {
        return file;
    }
}

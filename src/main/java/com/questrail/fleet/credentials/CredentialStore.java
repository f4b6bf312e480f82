package com.questrail.fleet.credentials;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.fleet.internal.time.WallClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * CredentialStore
 * =============================================================================
 * Seals the broker configuration with AES-GCM before it reaches storage and
 * opens it again into an in-memory {@link BrokerConfig}.
 *
 * <h2>Record</h2>
 * The whole configuration (host, credentials, client id...) is serialised to
 * JSON and encrypted as one blob. The stored {@link EncryptedCredentialRecord}
 * carries only the algorithm identifier, a fresh 96-bit nonce and the
 * ciphertext. A fixed associated-data label binds the blob to this use.
 *
 * <h2>Failure</h2>
 * Any problem opening the record (unparseable record, unknown algorithm,
 * authentication tag mismatch from corruption or a different key, invalid
 * contents) raises {@link ConfigException}. Nothing partial is ever returned.
 */
public final class CredentialStore
{
    private static final Logger log = LoggerFactory.getLogger(CredentialStore.class);

    public static final String ALGORITHM = "AES/GCM/NoPadding";
    static final int FORMAT_VERSION = 1;
    private static final int NONCE_BYTES = 12;
    private static final int TAG_BITS = 128;
    private static final byte[] ASSOCIATED_DATA = "fleet-link/broker-config/v1".getBytes(StandardCharsets.US_ASCII);

    private final CredentialRepository repository;
    private final KeyProvider keys;
    private final ObjectMapper mapper;
    private final WallClock clock;
    private final SecureRandom random = new SecureRandom();

    public CredentialStore(CredentialRepository repository, KeyProvider keys, ObjectMapper mapper, WallClock clock) {
        this.repository = Objects.requireNonNull(repository, "repository");
        this.keys = Objects.requireNonNull(keys, "keys");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Encrypt and persist {@code config}, replacing any previous record.
     */
    public void put(BrokerConfig config) {
        Objects.requireNonNull(config, "config");
        byte[] plaintext = null;
        try {
            plaintext = mapper.writeValueAsBytes(toJson(config));
            byte[] nonce = new byte[NONCE_BYTES];
            random.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.ENCRYPT_MODE, keys.key(), new GCMParameterSpec(TAG_BITS, nonce));
            cipher.updateAAD(ASSOCIATED_DATA);
            byte[] sealed = cipher.doFinal(plaintext);

            EncryptedCredentialRecord record = new EncryptedCredentialRecord(
                    FORMAT_VERSION,
                    ALGORITHM,
                    Base64.getEncoder().encodeToString(nonce),
                    Base64.getEncoder().encodeToString(sealed),
                    clock.now().toString());
            repository.write(mapper.writeValueAsBytes(record));
            log.info("Stored broker configuration for {}", config.brokerUrl());
        } catch (IOException | GeneralSecurityException e) {
            throw new ConfigException("cannot seal broker configuration", e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    /**
     * Decrypt the persisted configuration.
     *
     * @return empty when nothing was ever stored
     * @throws ConfigException when a record exists but cannot be opened
     */
    public Optional<BrokerConfig> get() {
        Optional<byte[]> raw = repository.read();
        if (raw.isEmpty()) {
            return Optional.empty();
        }

        EncryptedCredentialRecord record;
        try {
            record = mapper.readValue(raw.get(), EncryptedCredentialRecord.class);
        } catch (IOException e) {
            throw new ConfigException("credential store is corrupted", e);
        }
        if (record == null) {
            throw new ConfigException("credential store is corrupted");
        }
        if (record.formatVersion() != FORMAT_VERSION || !ALGORITHM.equals(record.algorithm())) {
            throw new ConfigException("unsupported credential record: version "
                    + record.formatVersion() + ", algorithm " + record.algorithm());
        }
        if (record.nonce() == null || record.ciphertext() == null) {
            throw new ConfigException("credential record is incomplete");
        }

        byte[] plaintext = null;
        try {
            byte[] nonce = Base64.getDecoder().decode(record.nonce());
            byte[] sealed = Base64.getDecoder().decode(record.ciphertext());

            Cipher cipher = Cipher.getInstance(ALGORITHM);
            cipher.init(Cipher.DECRYPT_MODE, keys.key(), new GCMParameterSpec(TAG_BITS, nonce));
            cipher.updateAAD(ASSOCIATED_DATA);
            plaintext = cipher.doFinal(sealed);
            return Optional.of(fromJson(mapper.readTree(plaintext)));
        } catch (AEADBadTagException e) {
            throw new ConfigException("credential store cannot be decrypted with the current key", e);
        } catch (IllegalArgumentException | IOException | GeneralSecurityException e) {
            throw new ConfigException("credential store is corrupted", e);
        } finally {
            if (plaintext != null) {
                Arrays.fill(plaintext, (byte) 0);
            }
        }
    }

    /**
     * The persisted configuration, or {@link BrokerConfig#defaults()} when
     * nothing was stored yet.
     */
    public BrokerConfig getOrDefault() {
        return get().orElseGet(BrokerConfig::defaults);
    }

    public void clear() {
        repository.delete();
    }

    private ObjectNode toJson(BrokerConfig config) {
        ObjectNode node = mapper.createObjectNode();
        node.put("host", config.host());
        node.put("port", config.port());
        node.put("useTls", config.useTls());
        node.put("username", config.username());
        node.put("password", config.password());
        node.put("clientId", config.clientId());
        node.put("keepAliveSeconds", config.keepAlive().getSeconds());
        node.put("interfaceName", config.interfaceName());
        return node;
    }

    private static BrokerConfig fromJson(JsonNode node) {
        return new BrokerConfig(
                text(node, "host"),
                requireField(node, "port").asInt(),
                requireField(node, "useTls").asBoolean(),
                text(node, "username"),
                text(node, "password"),
                text(node, "clientId"),
                Duration.ofSeconds(requireField(node, "keepAliveSeconds").asLong()),
                text(node, "interfaceName"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = requireField(node, field);
        if (!value.isTextual()) {
            throw new IllegalArgumentException("field " + field + " must be text");
        }
        return value.asText();
    }

    private static JsonNode requireField(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("missing field " + field);
        }
        return value;
    }
}

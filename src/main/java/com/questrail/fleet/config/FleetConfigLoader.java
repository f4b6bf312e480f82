package com.questrail.fleet.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.questrail.fleet.credentials.BrokerConfig;
import com.questrail.fleet.credentials.ConfigException;
import com.questrail.fleet.credentials.CredentialStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * FleetConfigLoader
 * =============================================================================
 * Resolves the startup configuration once, at process start.
 *
 * <h2>Resolution order</h2>
 * Later sources override earlier ones:
 * <ol>
 *   <li>built-in defaults ({@link BrokerConfig#defaults()}, {@link FleetSettings#defaults()})</li>
 *   <li>optional JSON settings file: tunables plus a non-secret {@code broker} section</li>
 *   <li>the broker configuration persisted in the {@link CredentialStore}</li>
 *   <li>environment variables {@code BROKER_HOST}, {@code BROKER_PORT},
 *       {@code BROKER_TLS}, {@code BROKER_USER}, {@code BROKER_PASS},
 *       {@code BROKER_CLIENT_ID} and {@code MAP_SERVICE_KEY}</li>
 * </ol>
 *
 * <p>Durations in the settings file are either ISO-8601 strings
 * ({@code "PT30S"}) or whole seconds.</p>
 */
public final class FleetConfigLoader
{
    private static final Logger log = LoggerFactory.getLogger(FleetConfigLoader.class);

    public static final String ENV_HOST = "BROKER_HOST";
    public static final String ENV_PORT = "BROKER_PORT";
    public static final String ENV_TLS = "BROKER_TLS";
    public static final String ENV_USER = "BROKER_USER";
    public static final String ENV_PASS = "BROKER_PASS";
    public static final String ENV_CLIENT_ID = "BROKER_CLIENT_ID";
    public static final String ENV_MAP_SERVICE_KEY = "MAP_SERVICE_KEY";

    private static final Set<String> TRUE_VALUES = Set.of("1", "true", "yes");

    private final ObjectMapper mapper;
    private final CredentialStore credentials;
    private final Function<String, String> environment;

    public FleetConfigLoader(ObjectMapper mapper, CredentialStore credentials) {
        this(mapper, credentials, System::getenv);
    }

    public FleetConfigLoader(ObjectMapper mapper, CredentialStore credentials, Function<String, String> environment) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    /**
     * @param settingsFile optional JSON settings file; a missing file is not an error
     * @throws ConfigException on an unreadable settings file, invalid values,
     *                         or a persisted credential record that cannot be opened
     */
    public FleetConfiguration load(Optional<Path> settingsFile) {
        Objects.requireNonNull(settingsFile, "settingsFile");

        BrokerConfig broker = BrokerConfig.defaults();
        FleetSettings settings = FleetSettings.defaults();

        Optional<JsonNode> file = settingsFile.filter(p -> Files.exists(p)).map(this::readFile);
        if (file.isPresent()) {
            settings = applySettings(settings, file.get());
            JsonNode brokerNode = file.get().path("broker");
            if (brokerNode.isObject()) {
                broker = applyBrokerSection(broker, brokerNode);
            }
        }

        Optional<BrokerConfig> persisted = credentials.get();
        if (persisted.isPresent()) {
            broker = persisted.get();
        }

        broker = applyEnvironment(broker);
        Optional<String> mapKey = env(ENV_MAP_SERVICE_KEY);

        log.info("Fleet link configured for {} (settings file: {}, persisted credentials: {})",
                broker.brokerUrl(), file.isPresent() ? settingsFile.get() : "none", persisted.isPresent());
        return new FleetConfiguration(broker, settings, mapKey);
    }

    private JsonNode readFile(Path path) {
        try {
            JsonNode root = mapper.readTree(Files.readAllBytes(path));
            if (root == null || !root.isObject()) {
                throw new ConfigException("settings file " + path + " must contain a JSON object");
            }
            return root;
        } catch (IOException e) {
            throw new ConfigException("cannot read settings file " + path, e);
        }
    }

    private static FleetSettings applySettings(FleetSettings defaults, JsonNode root) {
        FleetSettings.Builder b = defaults.toBuilder();
        try {
            duration(root, "healthProbeInterval").ifPresent(b::healthProbeInterval);
            integer(root, "missedProbeThreshold").ifPresent(b::missedProbeThreshold);
            duration(root, "backoffBase").ifPresent(b::backoffBase);
            duration(root, "backoffMax").ifPresent(b::backoffMax);
            integer(root, "maxReconnectAttempts").ifPresent(b::maxReconnectAttempts);
            duration(root, "staleAfter").ifPresent(b::staleAfter);
            duration(root, "offlineAfter").ifPresent(b::offlineAfter);
            integer(root, "telemetryWindowSize").ifPresent(b::telemetryWindowSize);
            duration(root, "ackTimeout").ifPresent(b::ackTimeout);
            duration(root, "connectTimeout").ifPresent(b::connectTimeout);
            duration(root, "publishTimeout").ifPresent(b::publishTimeout);
            duration(root, "idleTeardown").ifPresent(b::idleTeardown);
            integer(root, "missionHistoryLimit").ifPresent(b::missionHistoryLimit);
            integer(root, "maxNodesPerMission").ifPresent(b::maxNodesPerMission);
            text(root, "orderIdPrefix").ifPresent(b::orderIdPrefix);
            text(root, "protocolVersion").ifPresent(b::protocolVersion);
            return b.build();
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new ConfigException("invalid settings: " + e.getMessage(), e);
        }
    }

    private static BrokerConfig applyBrokerSection(BrokerConfig base, JsonNode node) {
        try {
            BrokerConfig out = base.withEndpoint(
                    text(node, "host").orElse(base.host()),
                    integer(node, "port").orElse(base.port()),
                    node.has("useTls") ? node.get("useTls").asBoolean() : base.useTls());
            out = out.withClientId(text(node, "clientId").orElse(out.clientId()));
            out = out.withInterfaceName(text(node, "interfaceName").orElse(out.interfaceName()));
            out = out.withKeepAlive(duration(node, "keepAlive").orElse(out.keepAlive()));
            if (node.has("password")) {
                log.warn("Ignoring broker password in settings file; store it encrypted instead");
            }
            return out.withCredentials(text(node, "username").orElse(out.username()), out.password());
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new ConfigException("invalid broker settings: " + e.getMessage(), e);
        }
    }

    private BrokerConfig applyEnvironment(BrokerConfig base) {
        String host = env(ENV_HOST).orElse(base.host());
        int port = base.port();
        Optional<String> rawPort = env(ENV_PORT);
        if (rawPort.isPresent()) {
            try {
                port = Integer.parseInt(rawPort.get().trim());
            } catch (NumberFormatException e) {
                throw new ConfigException(ENV_PORT + " is not a number: " + rawPort.get(), e);
            }
        }
        boolean tls = env(ENV_TLS)
                .map(v -> TRUE_VALUES.contains(v.trim().toLowerCase(Locale.ROOT)))
                .orElse(base.useTls());

        try {
            return base.withEndpoint(host, port, tls)
                    .withCredentials(env(ENV_USER).orElse(base.username()), env(ENV_PASS).orElse(base.password()))
                    .withClientId(env(ENV_CLIENT_ID).orElse(base.clientId()));
        } catch (IllegalArgumentException e) {
            throw new ConfigException("invalid broker environment: " + e.getMessage(), e);
        }
    }

    private Optional<String> env(String name) {
        String value = environment.apply(name);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return Optional.empty();
        }
        if (!v.isTextual()) {
            throw new IllegalArgumentException(field + " must be a string");
        }
        return Optional.of(v.asText());
    }

    private static Optional<Integer> integer(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return Optional.empty();
        }
        if (!v.canConvertToInt() || !v.isIntegralNumber()) {
            throw new IllegalArgumentException(field + " must be an integer");
        }
        return Optional.of(v.asInt());
    }

    private static Optional<Duration> duration(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) {
            return Optional.empty();
        }
        if (v.isIntegralNumber()) {
            return Optional.of(Duration.ofSeconds(v.asLong()));
        }
        if (v.isTextual()) {
            return Optional.of(Duration.parse(v.asText()));
        }
        throw new IllegalArgumentException(field + " must be an ISO-8601 duration or whole seconds");
    }
}

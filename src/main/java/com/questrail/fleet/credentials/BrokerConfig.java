package com.questrail.fleet.credentials;

import com.questrail.fleet.protocol.vda5050.codec.Vda5050TopicCodec;

import java.time.Duration;
import java.util.Objects;

/**
 * BrokerConfig
 * -----------------------------------------------------------------------------
 * Everything needed to open a broker session.
 *
 * <p>The password is plaintext only while the config lives in process memory.
 * It is encrypted by {@link CredentialStore} before it is persisted, and
 * {@link #toString()} never renders it.</p>
 *
 * @param interfaceName VDA5050 topic prefix, e.g. {@code uagv/v2}
 * @param keepAlive     MQTT keep-alive; PINGREQ is sent when the link is idle this long
 */
public record BrokerConfig(
        String host,
        int port,
        boolean useTls,
        String username,
        String password,
        String clientId,
        Duration keepAlive,
        String interfaceName
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 1883;
    public static final String DEFAULT_CLIENT_ID = "FleetLink";
    public static final Duration DEFAULT_KEEP_ALIVE = Duration.ofSeconds(60);
    public static final String DEFAULT_INTERFACE_NAME = "uagv/v2";

    public BrokerConfig {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(username, "username");
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(clientId, "clientId");
        Objects.requireNonNull(keepAlive, "keepAlive");
        if (host.isBlank()) {
            throw new IllegalArgumentException("host must not be blank");
        }
        if (port < 1 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (clientId.isBlank()) {
            throw new IllegalArgumentException("clientId must not be blank");
        }
        if (keepAlive.isNegative() || keepAlive.getSeconds() > 65535) {
            throw new IllegalArgumentException("keepAlive must be within 0..65535 seconds");
        }
        Vda5050TopicCodec.checkInterfaceName(interfaceName);
    }

    public static BrokerConfig defaults() {
        return new BrokerConfig(DEFAULT_HOST, DEFAULT_PORT, false, "", "", DEFAULT_CLIENT_ID,
                DEFAULT_KEEP_ALIVE, DEFAULT_INTERFACE_NAME);
    }

    public BrokerConfig withEndpoint(String newHost, int newPort, boolean tls) {
        return new BrokerConfig(newHost, newPort, tls, username, password, clientId, keepAlive, interfaceName);
    }

    public BrokerConfig withCredentials(String newUsername, String newPassword) {
        return new BrokerConfig(host, port, useTls, newUsername, newPassword, clientId, keepAlive, interfaceName);
    }

    public BrokerConfig withClientId(String newClientId) {
        return new BrokerConfig(host, port, useTls, username, password, newClientId, keepAlive, interfaceName);
    }

    public BrokerConfig withInterfaceName(String newInterfaceName) {
        return new BrokerConfig(host, port, useTls, username, password, clientId, keepAlive, newInterfaceName);
    }

    public BrokerConfig withKeepAlive(Duration newKeepAlive) {
        return new BrokerConfig(host, port, useTls, username, password, clientId, newKeepAlive, interfaceName);
    }

    public boolean hasCredentials() {
        return !username.isEmpty();
    }

    /**
     * {@code mqtt://host:port}, or {@code mqtts://host:port} when TLS is on.
     */
    public String brokerUrl() {
        return (useTls ? "mqtts://" : "mqtt://") + host + ":" + port;
    }

    @Override
    public String toString() {
        return "BrokerConfig[" + brokerUrl()
                + ", username=" + (username.isEmpty() ? "<none>" : username)
                + ", password=" + (password.isEmpty() ? "<none>" : "****")
                + ", clientId=" + clientId
                + ", keepAlive=" + keepAlive.getSeconds() + "s"
                + ", interfaceName=" + interfaceName + "]";
    }
}

package com.questrail.fleet.runtime;

import com.questrail.fleet.api.SessionState;
import com.questrail.fleet.config.FleetConfiguration;
import com.questrail.fleet.config.FleetSettings;
import com.questrail.fleet.credentials.BrokerConfig;
import com.questrail.fleet.observability.FleetErrorEvent;
import com.questrail.fleet.observability.RecordingObservabilitySink;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full production stack (Netty transport, executor scheduler) against a
 * loopback port with nothing listening.
 */
class FleetLinkRuntimeSmokeTest {

    @Test
    void fullStackLifecycleWithoutBroker() throws Exception {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        FleetSettings settings = FleetSettings.defaults().toBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
        FleetConfiguration configuration = new FleetConfiguration(
                BrokerConfig.defaults().withEndpoint("127.0.0.1", port, false), settings, Optional.empty());
        RecordingObservabilitySink sink = new RecordingObservabilitySink();

        FleetLinkRuntime runtime = FleetLinkRuntime.builder(configuration)
                .withObservabilitySink(sink)
                .build();
        assertNotNull(runtime);

        runtime.start();
        assertEquals(SessionState.DISCONNECTED, runtime.sessionState().get());
        assertTrue(sink.hasEventOfType(FleetErrorEvent.class), "refused connect is reported");

        runtime.stop();
        assertEquals(SessionState.DISCONNECTED, runtime.sessionState().get());
    }
}

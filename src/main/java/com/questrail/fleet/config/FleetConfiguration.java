package com.questrail.fleet.config;

import com.questrail.fleet.credentials.BrokerConfig;

import java.util.Objects;
import java.util.Optional;

/**
 * Fully resolved startup configuration.
 *
 * @param mapServiceKey opaque key for the third-party map tile service, if configured
 */
public record FleetConfiguration(BrokerConfig broker, FleetSettings settings, Optional<String> mapServiceKey) {
    public FleetConfiguration {
        Objects.requireNonNull(broker, "broker");
        Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(mapServiceKey, "mapServiceKey");
    }

    @Override
    public String toString() {
        return "FleetConfiguration[broker=" + broker
                + ", settings=" + settings
                + ", mapServiceKey=" + (mapServiceKey.isPresent() ? "****" : "<none>") + "]";
    }
}

/**
 * Netty MQTT 3.1.1 adapter for the broker transport port.
 *
 * <p>Netty types stay inside this package. Everything above it sees topics,
 * {@code byte[]} payloads and {@link java.util.concurrent.CompletableFuture}s.</p>
 */
package com.questrail.fleet.connection.netty;

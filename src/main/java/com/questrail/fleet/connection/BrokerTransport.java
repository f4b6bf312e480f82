package com.questrail.fleet.connection;

import com.questrail.fleet.credentials.BrokerConfig;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * BrokerTransport
 * -----------------------------------------------------------------------------
 * Port for a publish/subscribe broker session.
 *
 * <p>The port is deliberately small. It moves topics and bytes; it knows
 * nothing about VDA5050 and holds no retry policy. Every operation is
 * asynchronous and the {@link ConnectionManager} applies the timeouts.</p>
 *
 * <p>Implementations may be backed by Netty or a test harness.</p>
 */
public interface BrokerTransport
{
    /**
     * Register the listener for inbound traffic and lifecycle signals.
     * Must be called before {@link #open(BrokerConfig)}.
     */
    void setListener(BrokerTransportListener listener);

    /**
     * Resolve, connect, negotiate TLS if requested and authenticate.
     *
     * <p>The future completes when the broker accepted the session, or fails
     * with a {@link ConnectionException} naming the failure kind.</p>
     */
    CompletableFuture<Void> open(BrokerConfig config);

    /**
     * Subscribe to topic filters. Completes when the broker granted them.
     */
    CompletableFuture<Void> subscribe(List<String> topicFilters);

    CompletableFuture<Void> unsubscribe(List<String> topicFilters);

    /**
     * Publish at-least-once. Completes when the broker acknowledged receipt.
     */
    CompletableFuture<Void> publish(String topic, byte[] payload);

    /**
     * Close the current session, if any. Idempotent. An open session reports
     * {@link BrokerTransportListener#onTransportDown(Throwable)} with a
     * {@code null} cause.
     */
    void close();

    /**
     * Release all resources. The transport cannot be reopened afterwards.
     */
    void shutdown();
}

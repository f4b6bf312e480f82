package com.questrail.fleet.connection;

/**
 * BrokerTransportListener
 * -----------------------------------------------------------------------------
 * Callback sink for {@link BrokerTransport}.
 *
 * <p>Callbacks are delivered serially. Netty-backed transports deliver them on
 * the channel's event loop, so implementations must return quickly and never
 * block on broker I/O.</p>
 */
public interface BrokerTransportListener
{
    /**
     * An application message arrived on a subscribed topic.
     *
     * @param topic   concrete topic name
     * @param payload raw payload, owned by the callee
     */
    void onMessage(String topic, byte[] payload);

    /**
     * A keep-alive round trip was not answered in time. The session is still
     * open and inbound traffic may continue.
     */
    void onHeartbeatMissed();

    /**
     * The broker answered again after {@link #onHeartbeatMissed()}.
     */
    void onHeartbeatRestored();

    /**
     * The session ended.
     *
     * @param cause failure cause; {@code null} for an orderly close
     */
    void onTransportDown(Throwable cause);
}

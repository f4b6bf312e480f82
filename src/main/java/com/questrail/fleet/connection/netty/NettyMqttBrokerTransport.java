package com.questrail.fleet.connection.netty;

import com.questrail.fleet.connection.BrokerTransport;
import com.questrail.fleet.connection.BrokerTransportListener;
import com.questrail.fleet.connection.ConnectionException;
import com.questrail.fleet.connection.PublishException;
import com.questrail.fleet.credentials.BrokerConfig;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.mqtt.MqttDecoder;
import io.netty.handler.codec.mqtt.MqttEncoder;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.timeout.IdleStateHandler;

import javax.net.ssl.SSLException;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * NettyMqttBrokerTransport
 * =============================================================================
 * Netty-backed implementation of the {@link BrokerTransport} port, speaking
 * MQTT 3.1.1 over TCP or TLS.
 *
 * <h2>Architectural Role</h2>
 * This class is a <strong>pure transport adapter</strong>.
 *
 * It MUST NOT:
 * <ul>
 *   <li>Decode VDA5050 payloads</li>
 *   <li>Track session state beyond the current channel</li>
 *   <li>Retry, reconnect or apply timeouts other than the TCP connect budget</li>
 * </ul>
 *
 * <h2>Netty containment rule</h2>
 * Netty types (e.g., {@code Channel}, {@code EventLoopGroup}, {@code ByteBuf})
 * MUST NOT escape this package.
 *
 * <h2>Lifecycle</h2>
 * Each {@link #open(BrokerConfig)} creates a fresh channel on a shared
 * single-threaded event loop. Callbacks from a channel that has since been
 * replaced are suppressed, so a late close of an old session can never be
 * mistaken for the loss of the current one. {@link #shutdown()} releases the
 * event loop.
 *
 * <pre>
 *   [SslHandler] → MqttDecoder → MqttEncoder → [IdleStateHandler] → MqttClientHandler
 * </pre>
 */
public final class NettyMqttBrokerTransport implements BrokerTransport
{
    private static final int MAX_PACKET_BYTES = 256 * 1024;

    private final EventLoopGroup group;
    private final Duration tcpConnectTimeout;

    private volatile BrokerTransportListener listener;
    private volatile MqttClientHandler handler;

    /**
     * We use a dedicated {@link NioEventLoopGroup} with one thread: the whole
     * session, including listener callbacks, is serialized on it.
     */
    public NettyMqttBrokerTransport(Duration tcpConnectTimeout)
    {
        this.tcpConnectTimeout = Objects.requireNonNull(tcpConnectTimeout, "tcpConnectTimeout");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public void setListener(BrokerTransportListener listener)
    {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** JDK trust store, with the broker host checked against its certificate. */
    static SslContext clientSslContext() throws SSLException
    {
        return SslContextBuilder.forClient()
                .endpointIdentificationAlgorithm("HTTPS")
                .build();
    }

    @Override
    public CompletableFuture<Void> open(BrokerConfig config)
    {
        Objects.requireNonNull(config, "config");
        BrokerTransportListener l = requireListener();
        close();

        SslContext ssl = null;
        if (config.useTls()) {
            try {
                ssl = clientSslContext();
            } catch (SSLException e) {
                return CompletableFuture.failedFuture(new ConnectionException(ConnectionException.Kind.TLS,
                        "cannot initialise TLS for " + config.brokerUrl(), e));
            }
        }

        CurrentSessionListener guard = new CurrentSessionListener(l);
        MqttClientHandler h = new MqttClientHandler(config, guard);
        guard.owner = h;
        handler = h;

        SslContext sslContext = ssl;
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, tcpConnectTimeout.toMillis()))
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch)
                    {
                        ChannelPipeline p = ch.pipeline();
                        if (sslContext != null) {
                            p.addLast(sslContext.newHandler(ch.alloc(), config.host(), config.port()));
                        }
                        p.addLast(new MqttDecoder(MAX_PACKET_BYTES));
                        p.addLast(MqttEncoder.INSTANCE);
                        if (!config.keepAlive().isZero()) {
                            p.addLast(new IdleStateHandler(0, 0, config.keepAlive().getSeconds(), TimeUnit.SECONDS));
                        }
                        p.addLast(h);
                    }
                });

        ChannelFuture f = bootstrap.connect(config.host(), config.port());
        f.addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                h.failConnect(NettyFailures.classify(future.cause(), config));
            }
        });
        return h.connected();
    }

    @Override
    public CompletableFuture<Void> subscribe(List<String> topicFilters)
    {
        Objects.requireNonNull(topicFilters, "topicFilters");
        MqttClientHandler h = handler;
        if (h == null) {
            return CompletableFuture.failedFuture(new ConnectionException(ConnectionException.Kind.NETWORK,
                    "no broker session"));
        }
        return h.subscribe(topicFilters);
    }

    @Override
    public CompletableFuture<Void> unsubscribe(List<String> topicFilters)
    {
        Objects.requireNonNull(topicFilters, "topicFilters");
        MqttClientHandler h = handler;
        if (h == null) {
            return CompletableFuture.completedFuture(null);
        }
        return h.unsubscribe(topicFilters);
    }

    @Override
    public CompletableFuture<Void> publish(String topic, byte[] payload)
    {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(payload, "payload");
        MqttClientHandler h = handler;
        if (h == null) {
            return CompletableFuture.failedFuture(new PublishException("no broker session"));
        }
        return h.publish(topic, payload);
    }

    @Override
    public void close()
    {
        MqttClientHandler h = handler;
        if (h != null) {
            h.disconnect();
        }
    }

    @Override
    public void shutdown()
    {
        close();
        handler = null;
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS);
    }

    private BrokerTransportListener requireListener()
    {
        BrokerTransportListener l = listener;
        if (l == null) {
            throw new IllegalStateException("BrokerTransportListener must be set before open()");
        }
        return l;
    }

    /**
     * Forwards callbacks only while its handler is the current one.
     */
    private final class CurrentSessionListener implements BrokerTransportListener
    {
        private final BrokerTransportListener delegate;
        private volatile MqttClientHandler owner;

        CurrentSessionListener(BrokerTransportListener delegate)
        {
            this.delegate = delegate;
        }

        private boolean current()
        {
            return owner != null && owner == handler;
        }

        @Override
        public void onMessage(String topic, byte[] payload)
        {
            if (current()) {
                delegate.onMessage(topic, payload);
            }
        }

        @Override
        public void onHeartbeatMissed()
        {
            if (current()) {
                delegate.onHeartbeatMissed();
            }
        }

        @Override
        public void onHeartbeatRestored()
        {
            if (current()) {
                delegate.onHeartbeatRestored();
            }
        }

        @Override
        public void onTransportDown(Throwable cause)
        {
            if (current()) {
                delegate.onTransportDown(cause);
            }
        }
    }
}

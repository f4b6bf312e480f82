package com.questrail.fleet.connection.netty;

import com.questrail.fleet.connection.BrokerTransportListener;
import com.questrail.fleet.connection.ConnectionException;
import com.questrail.fleet.connection.PublishException;
import com.questrail.fleet.credentials.BrokerConfig;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.mqtt.MqttConnAckMessage;
import io.netty.handler.codec.mqtt.MqttConnectReturnCode;
import io.netty.handler.codec.mqtt.MqttFixedHeader;
import io.netty.handler.codec.mqtt.MqttMessage;
import io.netty.handler.codec.mqtt.MqttMessageBuilders;
import io.netty.handler.codec.mqtt.MqttMessageIdVariableHeader;
import io.netty.handler.codec.mqtt.MqttMessageType;
import io.netty.handler.codec.mqtt.MqttPublishMessage;
import io.netty.handler.codec.mqtt.MqttQoS;
import io.netty.handler.codec.mqtt.MqttSubAckMessage;
import io.netty.handler.codec.mqtt.MqttVersion;
import io.netty.handler.ssl.SslHandler;
import io.netty.handler.timeout.IdleStateEvent;
import io.netty.util.ReferenceCountUtil;
import io.netty.util.concurrent.FutureListener;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * MqttClientHandler
 * -----------------------------------------------------------------------------
 * MQTT 3.1.1 client session on one channel.
 *
 * <ul>
 *   <li>Sends CONNECT once the channel (and TLS, when present) is up and
 *       completes {@link #connected()} on CONNACK.</li>
 *   <li>Correlates SUBACK, UNSUBACK and PUBACK with their requests by packet id.</li>
 *   <li>Acknowledges inbound QoS 1 PUBLISH after handing the payload on.</li>
 *   <li>Sends PINGREQ whenever the link has been idle for the keep-alive
 *       period. An idle period that ends with a ping still unanswered is a
 *       missed heartbeat; the next PINGRESP restores it.</li>
 * </ul>
 *
 * <p>Inbound payloads are copied to {@code byte[]}; Netty buffers never reach
 * the listener.</p>
 */
final class MqttClientHandler extends SimpleChannelInboundHandler<MqttMessage>
{
    private static final int SUBSCRIPTION_FAILURE = 0x80;

    private final BrokerConfig config;
    private final BrokerTransportListener listener;

    private final CompletableFuture<Void> connected = new CompletableFuture<>();
    private final ConcurrentMap<Integer, CompletableFuture<Void>> pending = new ConcurrentHashMap<>();
    private final AtomicInteger packetIds = new AtomicInteger();
    private final AtomicBoolean downReported = new AtomicBoolean();

    private volatile Channel channel;
    private volatile ConnectionException failure;

    // Event loop only.
    private boolean pingOutstanding;
    private boolean heartbeatMissed;

    MqttClientHandler(BrokerConfig config, BrokerTransportListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    CompletableFuture<Void> connected() {
        return connected;
    }

    /**
     * Fail the pending CONNECT, e.g. when the TCP connect itself failed and
     * the channel never became active.
     */
    void failConnect(ConnectionException cause) {
        failure = cause;
        connected.completeExceptionally(cause);
    }

    // ---------------------------------------------------------------------
    // Outbound requests (any thread)
    // ---------------------------------------------------------------------

    CompletableFuture<Void> subscribe(List<String> filters) {
        int id = nextPacketId();
        MqttMessageBuilders.SubscribeBuilder b = MqttMessageBuilders.subscribe().messageId(id);
        for (String filter : filters) {
            b.addSubscription(MqttQoS.AT_LEAST_ONCE, filter);
        }
        return request(id, b.build());
    }

    CompletableFuture<Void> unsubscribe(List<String> filters) {
        int id = nextPacketId();
        MqttMessageBuilders.UnsubscribeBuilder b = MqttMessageBuilders.unsubscribe().messageId(id);
        for (String filter : filters) {
            b.addTopicFilter(filter);
        }
        return request(id, b.build());
    }

    CompletableFuture<Void> publish(String topic, byte[] payload) {
        int id = nextPacketId();
        MqttPublishMessage message = MqttMessageBuilders.publish()
                .topicName(topic)
                .qos(MqttQoS.AT_LEAST_ONCE)
                .retained(false)
                .messageId(id)
                .payload(Unpooled.wrappedBuffer(payload))
                .build();
        return request(id, message);
    }

    /**
     * Send DISCONNECT (if the session was accepted) and close the channel.
     */
    void disconnect() {
        Channel ch = channel;
        if (ch == null) {
            return;
        }
        if (ch.isActive() && connected.isDone() && !connected.isCompletedExceptionally()) {
            ch.writeAndFlush(control(MqttMessageType.DISCONNECT)).addListener(ChannelFutureListener.CLOSE);
        } else {
            ch.close();
        }
    }

    private CompletableFuture<Void> request(int packetId, MqttMessage message) {
        Channel ch = channel;
        CompletableFuture<Void> result = new CompletableFuture<>();
        if (ch == null || !ch.isActive()) {
            ReferenceCountUtil.release(message);
            result.completeExceptionally(new PublishException("broker session is not open"));
            return result;
        }
        pending.put(packetId, result);
        result.whenComplete((v, e) -> pending.remove(packetId, result));
        ch.writeAndFlush(message).addListener((ChannelFutureListener) write -> {
            if (!write.isSuccess()) {
                result.completeExceptionally(write.cause());
            }
        });
        return result;
    }

    private int nextPacketId() {
        return packetIds.updateAndGet(i -> i >= 0xFFFF ? 1 : i + 1);
    }

    // ---------------------------------------------------------------------
    // Channel lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void handlerAdded(ChannelHandlerContext ctx) {
        channel = ctx.channel();
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        SslHandler ssl = ctx.pipeline().get(SslHandler.class);
        if (ssl == null) {
            sendConnect(ctx);
        } else {
            ssl.handshakeFuture().addListener((FutureListener<Channel>) handshake -> {
                if (handshake.isSuccess()) {
                    sendConnect(ctx);
                } else {
                    failConnect(NettyFailures.classify(handshake.cause(), config));
                    ctx.close();
                }
            });
        }
        super.channelActive(ctx);
    }

    private void sendConnect(ChannelHandlerContext ctx) {
        MqttMessageBuilders.ConnectBuilder b = MqttMessageBuilders.connect()
                .clientId(config.clientId())
                .protocolVersion(MqttVersion.MQTT_3_1_1)
                .cleanSession(true)
                .keepAlive((int) config.keepAlive().getSeconds());
        if (!config.username().isEmpty()) {
            b.username(config.username());
            if (!config.password().isEmpty()) {
                b.password(config.password().getBytes(StandardCharsets.UTF_8));
            }
        }
        ctx.writeAndFlush(b.build());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, MqttMessage msg) {
        if (msg.decoderResult().isFailure()) {
            exceptionCaught(ctx, msg.decoderResult().cause());
            return;
        }
        switch (msg.fixedHeader().messageType()) {
            case CONNACK -> onConnAck(ctx, (MqttConnAckMessage) msg);
            case SUBACK -> onSubAck((MqttSubAckMessage) msg);
            case UNSUBACK, PUBACK -> complete(((MqttMessageIdVariableHeader) msg.variableHeader()).messageId());
            case PUBLISH -> onPublish(ctx, (MqttPublishMessage) msg);
            case PINGRESP -> onPingResponse();
            default -> { }
        }
    }

    private void onConnAck(ChannelHandlerContext ctx, MqttConnAckMessage msg) {
        MqttConnectReturnCode code = msg.variableHeader().connectReturnCode();
        if (code == MqttConnectReturnCode.CONNECTION_ACCEPTED) {
            connected.complete(null);
            return;
        }
        ConnectionException.Kind kind = switch (code) {
            case CONNECTION_REFUSED_BAD_USER_NAME_OR_PASSWORD,
                 CONNECTION_REFUSED_NOT_AUTHORIZED,
                 CONNECTION_REFUSED_IDENTIFIER_REJECTED -> ConnectionException.Kind.AUTH;
            default -> ConnectionException.Kind.NETWORK;
        };
        failConnect(new ConnectionException(kind, config.brokerUrl() + " refused the session: " + code));
        ctx.close();
    }

    private void onSubAck(MqttSubAckMessage msg) {
        int id = msg.variableHeader().messageId();
        CompletableFuture<Void> f = pending.get(id);
        if (f == null) {
            return;
        }
        if (msg.payload().grantedQoSLevels().contains(SUBSCRIPTION_FAILURE)) {
            f.completeExceptionally(new ConnectionException(ConnectionException.Kind.AUTH,
                    config.brokerUrl() + " refused a subscription"));
        } else {
            f.complete(null);
        }
    }

    private void complete(int packetId) {
        CompletableFuture<Void> f = pending.get(packetId);
        if (f != null) {
            f.complete(null);
        }
    }

    private void onPublish(ChannelHandlerContext ctx, MqttPublishMessage msg) {
        String topic = msg.variableHeader().topicName();
        ByteBuf content = msg.payload();
        byte[] bytes = new byte[content.readableBytes()];
        content.getBytes(content.readerIndex(), bytes);

        listener.onMessage(topic, bytes);

        if (msg.fixedHeader().qosLevel() == MqttQoS.AT_LEAST_ONCE) {
            ctx.writeAndFlush(new MqttMessage(
                    new MqttFixedHeader(MqttMessageType.PUBACK, false, MqttQoS.AT_MOST_ONCE, false, 0),
                    MqttMessageIdVariableHeader.from(msg.variableHeader().packetId())));
        }
    }

    private void onPingResponse() {
        pingOutstanding = false;
        if (heartbeatMissed) {
            heartbeatMissed = false;
            listener.onHeartbeatRestored();
        }
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (!(evt instanceof IdleStateEvent)) {
            super.userEventTriggered(ctx, evt);
            return;
        }
        if (!connected.isDone() || connected.isCompletedExceptionally()) {
            return;
        }
        if (pingOutstanding && !heartbeatMissed) {
            heartbeatMissed = true;
            listener.onHeartbeatMissed();
        }
        pingOutstanding = true;
        ctx.writeAndFlush(control(MqttMessageType.PINGREQ));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        ConnectionException classified = NettyFailures.classify(cause, config);
        failure = classified;
        connected.completeExceptionally(classified);
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        ConnectionException cause = failure;
        connected.completeExceptionally(cause != null ? cause
                : new ConnectionException(ConnectionException.Kind.NETWORK,
                        config.brokerUrl() + " closed the connection before accepting the session"));

        PublishException closed = new PublishException("broker session closed");
        for (Map.Entry<Integer, CompletableFuture<Void>> e : pending.entrySet()) {
            e.getValue().completeExceptionally(closed);
        }

        if (downReported.compareAndSet(false, true)) {
            listener.onTransportDown(cause);
        }
        super.channelInactive(ctx);
    }

    private static MqttMessage control(MqttMessageType type) {
        return new MqttMessage(new MqttFixedHeader(type, false, MqttQoS.AT_MOST_ONCE, false, 0));
    }
}

package com.questrail.fleet.connection.netty;

import com.questrail.fleet.connection.ConnectionException;
import com.questrail.fleet.credentials.BrokerConfig;
import io.netty.channel.ConnectTimeoutException;

import javax.net.ssl.SSLException;
import java.net.UnknownHostException;

/**
 * Maps Netty and socket failures onto {@link ConnectionException.Kind}.
 */
final class NettyFailures
{
    private NettyFailures() {}

    static ConnectionException classify(Throwable cause, BrokerConfig config) {
        String target = config.brokerUrl();
        for (Throwable c = cause; c != null; c = c.getCause()) {
            if (c instanceof ConnectionException ce) {
                return ce;
            }
            if (c instanceof UnknownHostException) {
                return new ConnectionException(ConnectionException.Kind.DNS,
                        "cannot resolve " + config.host(), cause);
            }
            if (c instanceof SSLException) {
                return new ConnectionException(ConnectionException.Kind.TLS,
                        "TLS negotiation with " + target + " failed: " + c.getMessage(), cause);
            }
            if (c instanceof ConnectTimeoutException) {
                return new ConnectionException(ConnectionException.Kind.TIMEOUT,
                        "TCP connect to " + target + " timed out", cause);
            }
            if (c.getCause() == c) {
                break;
            }
        }
        return new ConnectionException(ConnectionException.Kind.NETWORK,
                "connection to " + target + " failed: " + cause, cause);
    }
}

package com.questrail.fleet.connection;

import com.questrail.fleet.credentials.BrokerConfig;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * In-memory {@link BrokerTransport} for tests.
 *
 * <p>Operations complete immediately unless a failure was queued. Tests inject
 * inbound frames and session loss through the helper methods, which call the
 * registered listener on the test thread.</p>
 */
public final class FakeBrokerTransport implements BrokerTransport {

    public record Published(String topic, byte[] payload) {
        public String payloadAsString() {
            return new String(payload, StandardCharsets.UTF_8);
        }
    }

    private BrokerTransportListener listener;
    private boolean open;
    private boolean shutdown;
    private int openCount;
    private int closeCount;

    private final Deque<CompletableFuture<Void>> openOutcomes = new ArrayDeque<>();
    private final List<BrokerConfig> openedWith = new ArrayList<>();
    private final List<List<String>> subscribeCalls = new ArrayList<>();
    private final List<List<String>> unsubscribeCalls = new ArrayList<>();
    private final List<Published> published = new ArrayList<>();
    private RuntimeException publishFailure;
    private RuntimeException subscribeFailure;
    private RuntimeException openThrows;

    @Override
    public synchronized void setListener(BrokerTransportListener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized CompletableFuture<Void> open(BrokerConfig config) {
        if (shutdown) {
            throw new IllegalStateException("transport shut down");
        }
        openCount++;
        openedWith.add(config);
        if (openThrows != null) {
            RuntimeException failure = openThrows;
            openThrows = null;
            throw failure;
        }
        CompletableFuture<Void> outcome = openOutcomes.poll();
        if (outcome == null) {
            open = true;
            return CompletableFuture.completedFuture(null);
        }
        return outcome.thenRun(() -> {
            synchronized (this) {
                open = true;
            }
        });
    }

    @Override
    public synchronized CompletableFuture<Void> subscribe(List<String> topicFilters) {
        subscribeCalls.add(List.copyOf(topicFilters));
        if (subscribeFailure != null) {
            return CompletableFuture.failedFuture(subscribeFailure);
        }
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> unsubscribe(List<String> topicFilters) {
        unsubscribeCalls.add(List.copyOf(topicFilters));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public synchronized CompletableFuture<Void> publish(String topic, byte[] payload) {
        if (publishFailure != null) {
            return CompletableFuture.failedFuture(publishFailure);
        }
        published.add(new Published(topic, payload.clone()));
        return CompletableFuture.completedFuture(null);
    }

    @Override
    public void close() {
        BrokerTransportListener l;
        synchronized (this) {
            closeCount++;
            if (!open) {
                return;
            }
            open = false;
            l = listener;
        }
        l.onTransportDown(null);
    }

    @Override
    public synchronized void shutdown() {
        shutdown = true;
        open = false;
    }

    // ---------------------------------------------------------------------
    // Test controls
    // ---------------------------------------------------------------------

    /** The next {@link #open} fails with {@code failure}. */
    public synchronized void failNextOpen(Throwable failure) {
        openOutcomes.add(CompletableFuture.failedFuture(failure));
    }

    /** The next {@code count} opens fail with {@code failure}. */
    public synchronized void failNextOpens(int count, Throwable failure) {
        for (int i = 0; i < count; i++) {
            failNextOpen(failure);
        }
    }

    /** The next {@link #open} never completes; returns the future to let tests complete it. */
    public synchronized CompletableFuture<Void> hangNextOpen() {
        CompletableFuture<Void> pending = new CompletableFuture<>();
        openOutcomes.add(pending);
        return pending;
    }

    /** The next {@link #open} throws instead of returning a future. */
    public synchronized void throwFromNextOpen(RuntimeException failure) {
        this.openThrows = failure;
    }

    public synchronized void failPublishes(RuntimeException failure) {
        this.publishFailure = failure;
    }

    public synchronized void failSubscribes(RuntimeException failure) {
        this.subscribeFailure = failure;
    }

    public void inject(String topic, String json) {
        listener().onMessage(topic, json.getBytes(StandardCharsets.UTF_8));
    }

    /** Simulate the broker dropping the session. */
    public void drop(Throwable cause) {
        synchronized (this) {
            open = false;
        }
        listener().onTransportDown(cause);
    }

    public void missHeartbeat() {
        listener().onHeartbeatMissed();
    }

    public void restoreHeartbeat() {
        listener().onHeartbeatRestored();
    }

    private synchronized BrokerTransportListener listener() {
        return listener;
    }

    public synchronized boolean isOpen() {
        return open;
    }

    public synchronized boolean isShutdown() {
        return shutdown;
    }

    public synchronized int openCount() {
        return openCount;
    }

    public synchronized int closeCount() {
        return closeCount;
    }

    public synchronized List<BrokerConfig> openedWith() {
        return List.copyOf(openedWith);
    }

    public synchronized List<List<String>> subscribeCalls() {
        return List.copyOf(subscribeCalls);
    }

    public synchronized List<List<String>> unsubscribeCalls() {
        return List.copyOf(unsubscribeCalls);
    }

    public synchronized List<Published> published() {
        return List.copyOf(published);
    }
}

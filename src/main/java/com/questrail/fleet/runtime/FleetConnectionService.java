package com.questrail.fleet.runtime;

import com.questrail.fleet.internal.time.Cancellable;
import com.questrail.fleet.internal.time.MonotonicClock;
import com.questrail.fleet.internal.time.MonotonicScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * FleetConnectionService
 * =============================================================================
 * Process-wide owner of the fleet link, shared by every dashboard client.
 *
 * <h2>Lifecycle</h2>
 * <ul>
 *   <li>The first {@link #attach()} builds and starts a {@link FleetLinkRuntime}.</li>
 *   <li>Further attaches share it.</li>
 *   <li>When the last attachment closes, teardown is scheduled after
 *       {@code idleTeardown}. An attach before then cancels it.</li>
 *   <li>{@link #shutdown()} stops the runtime at once and refuses new
 *       attachments.</li>
 * </ul>
 *
 * <p>All state changes happen under one lock; a teardown that fires after a
 * newer attach or after a rebuild is recognised by its generation and ignored.</p>
 */
public final class FleetConnectionService
{
    private static final Logger log = LoggerFactory.getLogger(FleetConnectionService.class);

    /**
     * A client's hold on the shared runtime. Closing it twice is harmless.
     */
    public final class Attachment implements AutoCloseable {
        private final FleetLinkRuntime runtime;
        private boolean closed;

        private Attachment(FleetLinkRuntime runtime) {
            this.runtime = runtime;
        }

        public FleetLinkRuntime runtime() {
            return runtime;
        }

        @Override
        public void close() {
            synchronized (lock) {
                if (closed) {
                    return;
                }
                closed = true;
            }
            detach();
        }
    }

    private final Supplier<FleetLinkRuntime> factory;
    private final Duration idleTeardown;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;

    private final Object lock = new Object();
    private FleetLinkRuntime runtime;
    private int clients;
    private long generation;
    private Cancellable pendingTeardown;
    private boolean shutdown;

    public FleetConnectionService(Supplier<FleetLinkRuntime> factory,
                                  Duration idleTeardown,
                                  MonotonicClock clock,
                                  MonotonicScheduler scheduler) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.idleTeardown = Objects.requireNonNull(idleTeardown, "idleTeardown");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /**
     * Join the shared fleet link, starting it if nobody holds it.
     *
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public Attachment attach() {
        synchronized (lock) {
            if (shutdown) {
                throw new IllegalStateException("fleet connection service is shut down");
            }
            cancelTeardown();
            if (runtime == null) {
                runtime = factory.get();
                generation++;
                log.info("First client attached, starting fleet link");
                runtime.start();
            }
            clients++;
            return new Attachment(runtime);
        }
    }

    public int clientCount() {
        synchronized (lock) {
            return clients;
        }
    }

    public boolean isRunning() {
        synchronized (lock) {
            return runtime != null;
        }
    }

    /**
     * Stop the runtime now, whatever the client count. Idempotent.
     */
    public void shutdown() {
        FleetLinkRuntime toStop;
        synchronized (lock) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            cancelTeardown();
            toStop = runtime;
            runtime = null;
            clients = 0;
        }
        if (toStop != null) {
            log.info("Shutting down fleet link");
            toStop.stop();
        }
    }

    private void detach() {
        synchronized (lock) {
            if (shutdown || clients == 0) {
                return;
            }
            clients--;
            if (clients > 0) {
                return;
            }
            long expected = generation;
            log.info("Last client detached, fleet link stops in {} unless a client returns", idleTeardown);
            pendingTeardown = scheduler.scheduleAfter(idleTeardown, clock, () -> teardownIfIdle(expected));
        }
    }

    private void teardownIfIdle(long expectedGeneration) {
        FleetLinkRuntime toStop;
        synchronized (lock) {
            if (clients > 0 || runtime == null || generation != expectedGeneration) {
                return;
            }
            pendingTeardown = null;
            toStop = runtime;
            runtime = null;
        }
        log.info("No clients for {}, stopping fleet link", idleTeardown);
        toStop.stop();
    }

    private void cancelTeardown() {
        if (pendingTeardown != null) {
            pendingTeardown.cancel();
            pendingTeardown = null;
        }
    }
}

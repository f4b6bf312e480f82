package com.questrail.fleet.mission;

import com.questrail.fleet.api.AckState;
import com.questrail.fleet.api.VehicleId;
import com.questrail.fleet.connection.ConnectionManager;
import com.questrail.fleet.connection.PublishException;
import com.questrail.fleet.internal.time.MonotonicClock;
import com.questrail.fleet.internal.time.MonotonicScheduler;
import com.questrail.fleet.internal.time.WallClock;
import com.questrail.fleet.observability.FleetObservabilitySink;
import com.questrail.fleet.observability.MissionEvent;
import com.questrail.fleet.protocol.vda5050.codec.EncodedMessage;
import com.questrail.fleet.protocol.vda5050.codec.EncodedOrder;
import com.questrail.fleet.protocol.vda5050.codec.Vda5050MessageEncoder;
import com.questrail.fleet.protocol.vda5050.model.Action;
import com.questrail.fleet.protocol.vda5050.model.AgvError;
import com.questrail.fleet.protocol.vda5050.model.BlockingType;
import com.questrail.fleet.protocol.vda5050.model.Order;
import com.questrail.fleet.protocol.vda5050.model.StateMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * MissionDispatcher
 * =============================================================================
 * Sends orders to vehicles and tracks their acknowledgement.
 *
 * <h2>Dispatch</h2>
 * {@link #dispatch(VehicleId, Order)} validates the route, assigns an order id
 * if none was given, encodes (which assigns the orderUpdateId) and publishes.
 * Only a publish the broker acknowledged is recorded as PENDING; a
 * {@link PublishException} propagates and leaves no trace in history.
 *
 * <h2>Acknowledgement</h2>
 * Matching is a map lookup on the decode thread, never a wait:
 * <ul>
 *   <li>ACKED: a state message from the same vehicle reports the same
 *       orderId with an orderUpdateId at least the dispatched one.</li>
 *   <li>FAILED: a state error of an order-related type references the
 *       orderId.</li>
 *   <li>TIMEOUT: the deadline passed while still PENDING. Fires at most once
 *       per dispatched update.</li>
 * </ul>
 *
 * <h2>No automatic retry</h2>
 * Re-sending a motion command the vehicle may already be executing is unsafe.
 * A TIMEOUT or FAILED order is only re-sent by {@link #retry(String)}, which
 * an operator invokes.
 *
 * <h2>History</h2>
 * Bounded by {@code historyLimit}. Terminal orders are evicted oldest first;
 * PENDING orders are never evicted.
 */
public final class MissionDispatcher
{
    private static final Logger log = LoggerFactory.getLogger(MissionDispatcher.class);

    /** Error types that mean the vehicle rejected or could not run an order. */
    public static final Set<String> ORDER_ERROR_TYPES =
            Set.of("orderError", "orderUpdateError", "validationError", "noRouteError");

    private final ConnectionManager connection;
    private final Vda5050MessageEncoder encoder;
    private final OrderIdGenerator orderIds;
    private final Duration ackTimeout;
    private final int historyLimit;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final FleetObservabilitySink sink;

    private final ConcurrentMap<String, MissionOrder> orders = new ConcurrentHashMap<>();
    private final ConcurrentLinkedQueue<String> dispatchOrder = new ConcurrentLinkedQueue<>();
    private final List<MissionListener> listeners = new CopyOnWriteArrayList<>();
    private final Object dispatchLock = new Object();

    public MissionDispatcher(ConnectionManager connection,
                             Vda5050MessageEncoder encoder,
                             OrderIdGenerator orderIds,
                             Duration ackTimeout,
                             int historyLimit,
                             MonotonicClock clock,
                             MonotonicScheduler scheduler,
                             WallClock wallClock,
                             FleetObservabilitySink sink) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.encoder = Objects.requireNonNull(encoder, "encoder");
        this.orderIds = Objects.requireNonNull(orderIds, "orderIds");
        this.ackTimeout = Objects.requireNonNull(ackTimeout, "ackTimeout");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.sink = Objects.requireNonNull(sink, "sink");
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be >= 1");
        }
        this.historyLimit = historyLimit;
    }

    public Runnable addListener(MissionListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ---------------------------------------------------------------------
    // Operator actions
    // ---------------------------------------------------------------------

    /**
     * Validate, publish and record an order.
     *
     * @param order route to send; a blank orderId is replaced by a generated one
     * @return the PENDING record
     * @throws MissionException INVALID_ORDER for a bad route or order id
     * @throws PublishException if the session is not CONNECTED or the broker did not acknowledge
     */
    public MissionOrder dispatch(VehicleId vehicle, Order order) {
        Objects.requireNonNull(vehicle, "vehicle");
        Objects.requireNonNull(order, "order");

        Order named = order.orderId().isBlank()
                ? new Order(orderIds.next(), order.orderUpdateId(), order.nodes(), order.edges())
                : order;
        if (!OrderIdGenerator.isValid(named.orderId())) {
            throw new MissionException(MissionException.Reason.INVALID_ORDER,
                    "order id '" + named.orderId() + "' may only contain letters, digits, '-' and '_'");
        }
        OrderValidator.validate(named);

        synchronized (dispatchLock) {
            MissionOrder existing = orders.get(named.orderId());
            if (existing != null && existing.ackState() == AckState.PENDING) {
                throw new MissionException(MissionException.Reason.ILLEGAL_STATE,
                        "order " + named.orderId() + " is still awaiting acknowledgement");
            }
            MissionOrder recorded = publishAndRecord(vehicle, named);
            if (existing == null) {
                dispatchOrder.add(recorded.orderId());
            }
            evictIfNeeded();
            return recorded;
        }
    }

    /**
     * Re-send a TIMEOUT or FAILED order with the next orderUpdateId.
     *
     * @throws MissionException UNKNOWN_ORDER or ILLEGAL_STATE
     * @throws PublishException as for {@link #dispatch(VehicleId, Order)}
     */
    public MissionOrder retry(String orderId) {
        Objects.requireNonNull(orderId, "orderId");
        synchronized (dispatchLock) {
            MissionOrder previous = orders.get(orderId);
            if (previous == null) {
                throw new MissionException(MissionException.Reason.UNKNOWN_ORDER, "no order " + orderId);
            }
            if (previous.ackState() != AckState.TIMEOUT && previous.ackState() != AckState.FAILED) {
                throw new MissionException(MissionException.Reason.ILLEGAL_STATE,
                        "order " + orderId + " is " + previous.ackState() + "; only TIMEOUT or FAILED orders can be retried");
            }
            log.info("Operator retry of order {} after {}", orderId, previous.ackState());
            return publishAndRecord(previous.vehicle(), previous.order().withOrderUpdateId(previous.orderUpdateId() + 1));
        }
    }

    /**
     * Ask the vehicle to cancel its current order via a {@code cancelOrder}
     * instant action.
     *
     * @throws PublishException as for {@link #dispatch(VehicleId, Order)}
     */
    public void cancel(VehicleId vehicle) {
        Objects.requireNonNull(vehicle, "vehicle");
        Action cancel = Action.of("cancelOrder", "cancel-" + UUID.randomUUID(), BlockingType.HARD);
        EncodedMessage message = encoder.encodeInstantActions(vehicle, List.of(cancel));
        connection.publish(message.topic(), message.payload());
        log.info("Sent cancelOrder to {}", vehicle);
    }

    private MissionOrder publishAndRecord(VehicleId vehicle, Order order) {
        EncodedOrder encoded = encoder.encodeOrder(vehicle, order);
        try {
            connection.publish(encoded.message().topic(), encoded.message().payload());
        } catch (PublishException e) {
            // Orders in history keep their counter so a retry never reuses an id.
            if (!orders.containsKey(order.orderId())) {
                encoder.updateSequencer().forget(order.orderId());
            }
            throw e;
        }

        long deadlineNanos = clock.nowNanos() + ackTimeout.toNanos();
        Instant now = wallClock.now();
        MissionOrder pending = MissionOrder.pending(vehicle, encoded.order(), now, now.plus(ackTimeout), deadlineNanos);
        orders.put(pending.orderId(), pending);

        long updateId = pending.orderUpdateId();
        scheduler.scheduleAtNanos(deadlineNanos, () -> expire(pending.orderId(), updateId));
        notifyUpdate(pending);
        return pending;
    }

    // ---------------------------------------------------------------------
    // Acknowledgement path (decode thread)
    // ---------------------------------------------------------------------

    /**
     * Match a decoded state message against PENDING orders.
     */
    public void onStateMessage(StateMessage state) {
        Objects.requireNonNull(state, "state");

        if (state.hasActiveOrder()) {
            resolve(state.orderId(), AckState.ACKED, "", o ->
                    o.vehicle().equals(state.vehicle()) && state.orderUpdateId() >= o.orderUpdateId());
        }

        for (AgvError error : state.errors()) {
            if (!ORDER_ERROR_TYPES.contains(error.errorType())) {
                continue;
            }
            Optional<String> referenced = error.reference("orderId");
            if (referenced.isPresent()) {
                String why = error.errorType() + (error.description().isEmpty() ? "" : ": " + error.description());
                resolve(referenced.get(), AckState.FAILED, why, o -> o.vehicle().equals(state.vehicle()));
            }
        }
    }

    private void expire(String orderId, long updateId) {
        resolve(orderId, AckState.TIMEOUT, "no acknowledgement within " + ackTimeout,
                o -> o.orderUpdateId() == updateId);
    }

    private void resolve(String orderId, AckState outcome, String why, Predicate<MissionOrder> matches) {
        MissionOrder[] changed = new MissionOrder[1];
        orders.computeIfPresent(orderId, (id, current) -> {
            if (current.ackState() != AckState.PENDING || !matches.test(current)) {
                return current;
            }
            changed[0] = current.resolve(outcome, wallClock.now(), why);
            return changed[0];
        });
        if (changed[0] != null) {
            notifyUpdate(changed[0]);
        }
    }

    // ---------------------------------------------------------------------
    // History
    // ---------------------------------------------------------------------

    public Optional<MissionOrder> find(String orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    /**
     * The order, provided the vehicle acknowledged it.
     *
     * @throws MissionException UNKNOWN_ORDER if not in history, ACK_TIMEOUT if
     *         the deadline passed, ILLEGAL_STATE if still PENDING or FAILED
     */
    public MissionOrder requireAcked(String orderId) {
        MissionOrder o = find(orderId).orElseThrow(() ->
                new MissionException(MissionException.Reason.UNKNOWN_ORDER, "no order " + orderId));
        return switch (o.ackState()) {
            case ACKED -> o;
            case TIMEOUT -> throw new MissionException(MissionException.Reason.ACK_TIMEOUT,
                    "order " + orderId + " was not acknowledged by " + o.vehicle() + " before " + o.ackDeadline());
            case PENDING, FAILED -> throw new MissionException(MissionException.Reason.ILLEGAL_STATE,
                    "order " + orderId + " is " + o.ackState() + (o.detail().isEmpty() ? "" : " (" + o.detail() + ")"));
        };
    }

    /**
     * All remembered orders, most recently dispatched first.
     */
    public List<MissionOrder> history() {
        List<MissionOrder> all = new ArrayList<>(orders.values());
        all.sort(Comparator.comparing(MissionOrder::dispatchedAt).reversed());
        return List.copyOf(all);
    }

    public List<MissionOrder> pending() {
        return history().stream().filter(o -> o.ackState() == AckState.PENDING).toList();
    }

    private void evictIfNeeded() {
        Iterator<String> it = dispatchOrder.iterator();
        while (orders.size() > historyLimit && it.hasNext()) {
            String id = it.next();
            MissionOrder o = orders.get(id);
            if (o == null) {
                it.remove();
                continue;
            }
            if (o.ackState().isTerminal()) {
                orders.remove(id, o);
                it.remove();
                encoder.updateSequencer().forget(id);
                log.debug("Evicted order {} ({}) from history", id, o.ackState());
            }
        }
    }

    private void notifyUpdate(MissionOrder order) {
        sink.onMissionEvent(new MissionEvent(wallClock.now(), order.orderId(), order.orderUpdateId(),
                order.vehicle(), order.ackState()));
        for (MissionListener l : listeners) {
            try {
                l.onMissionUpdate(order);
            } catch (RuntimeException e) {
                log.error("Mission listener failed for order {}", order.orderId(), e);
            }
        }
    }
}

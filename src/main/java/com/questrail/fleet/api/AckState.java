package com.questrail.fleet.api;

/**
 * Acknowledgement state of a dispatched mission order.
 */
public enum AckState
{
    /** Published; waiting for the vehicle to report the order in its state. */
    PENDING,

    /** The vehicle reported the order (same orderId, same or newer orderUpdateId). */
    ACKED,

    /** The vehicle reported an order-related error referencing this order. */
    FAILED,

    /** The acknowledgement deadline elapsed first. Never retried automatically. */
    TIMEOUT;

    public boolean isTerminal() {
        return this != PENDING;
    }
}

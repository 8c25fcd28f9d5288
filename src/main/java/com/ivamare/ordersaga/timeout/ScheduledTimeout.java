package com.ivamare.ordersaga.timeout;

import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.message.Timeout;

import java.time.Duration;
import java.util.UUID;

/**
 * A timer to deliver a {@link Timeout} back to the saga after {@code delay}.
 *
 * @param orderId Order identity
 * @param token Stream version at which the wait began
 * @param awaitedStatus Status being awaited
 * @param delay SLA window for the awaited status
 */
public record ScheduledTimeout(UUID orderId, long token, OrderStatus awaitedStatus, Duration delay) {

    public Timeout toMessage() {
        return Timeout.of(orderId, token, awaitedStatus);
    }
}

package com.ivamare.ordersaga.timeout;

import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.OrderStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Works out which timer, if any, a state change needs.
 *
 * <p>A timer is needed whenever a decision began a new wait, i.e. the saga's pending
 * timeout token changed to a non-null value. Earlier timers are never cancelled; they
 * carry an older token and are ignored as stale when they fire.
 */
public class TimeoutScheduler {

    private final Map<OrderStatus, Duration> slaWindows;

    public TimeoutScheduler(Map<OrderStatus, Duration> slaWindows) {
        Map<OrderStatus, Duration> copy = new EnumMap<>(OrderStatus.class);
        for (OrderStatus status : OrderStatus.values()) {
            if (status.isAwaiting()) {
                Duration window = slaWindows.get(status);
                if (window == null || window.isNegative() || window.isZero()) {
                    throw new IllegalArgumentException("No positive SLA window for " + status);
                }
                copy.put(status, window);
            }
        }
        this.slaWindows = Collections.unmodifiableMap(copy);
    }

    /**
     * Timer for the transition from {@code before} to {@code after}.
     *
     * @return Timer to schedule, or empty when no new wait began
     */
    public Optional<ScheduledTimeout> scheduleFor(OrderSaga before, OrderSaga after) {
        Long token = after.pendingTimeoutToken();
        if (token == null || token.equals(before.pendingTimeoutToken()) || !after.status().isAwaiting()) {
            return Optional.empty();
        }
        return Optional.of(new ScheduledTimeout(after.orderId(), token, after.status(), slaWindows.get(after.status())));
    }

    /**
     * SLA window for an awaiting status.
     */
    public Duration windowFor(OrderStatus status) {
        Duration window = slaWindows.get(status);
        if (window == null) {
            throw new IllegalArgumentException(status + " is not an awaiting status");
        }
        return window;
    }
}

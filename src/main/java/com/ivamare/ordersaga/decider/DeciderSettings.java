package com.ivamare.ordersaga.decider;

/**
 * Tunables of the decision rules.
 *
 * @param maxDeliveryAttempts Failed delivery attempts after which the order is cancelled
 */
public record DeciderSettings(int maxDeliveryAttempts) {

    public static final int DEFAULT_MAX_DELIVERY_ATTEMPTS = 3;

    public DeciderSettings {
        if (maxDeliveryAttempts < 1) {
            throw new IllegalArgumentException("maxDeliveryAttempts must be at least 1");
        }
    }

    public static DeciderSettings defaults() {
        return new DeciderSettings(DEFAULT_MAX_DELIVERY_ATTEMPTS);
    }
}

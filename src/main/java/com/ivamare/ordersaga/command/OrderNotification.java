package com.ivamare.ordersaga.command;

import java.util.UUID;

/**
 * Order status change published to downstream consumers.
 *
 * @param type Notification type
 * @param orderId Order identity
 * @param customerId Customer who placed the order
 * @param reasonCode Machine-readable reason for a cancellation (nullable)
 */
public record OrderNotification(
    NotificationType type,
    UUID orderId,
    UUID customerId,
    String reasonCode
) {
}

package com.ivamare.ordersaga.command;

/**
 * Order status notifications published for view and notification consumers.
 */
public enum NotificationType {
    ORDER_PLACED("OrderPlaced"),
    ORDER_CANCELLED("OrderCancelled"),
    ORDER_DELIVERED("OrderDelivered");

    private final String wireName;

    NotificationType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}

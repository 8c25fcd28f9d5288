package com.ivamare.ordersaga.message;

import java.util.HashMap;
import java.util.Map;

/**
 * Inbound message types and their wire names.
 */
public enum InboundMessageType {
    CHECKOUT_COMPLETED("CheckoutCompleted", CheckoutCompleted.class),
    PAYMENT_AUTHORIZED("PaymentAuthorized", PaymentAuthorized.class),
    PAYMENT_FAILED("PaymentFailed", PaymentFailed.class),
    PAYMENT_CAPTURED("PaymentCaptured", PaymentCaptured.class),
    PAYMENT_CAPTURE_FAILED("PaymentCaptureFailed", PaymentCaptureFailed.class),
    REFUND_COMPLETED("RefundCompleted", RefundCompleted.class),
    REFUND_FAILED("RefundFailed", RefundFailed.class),
    RESERVATION_CONFIRMED("ReservationConfirmed", ReservationConfirmed.class),
    RESERVATION_FAILED("ReservationFailed", ReservationFailed.class),
    RESERVATION_COMMITTED("ReservationCommitted", ReservationCommitted.class),
    RESERVATION_RELEASED("ReservationReleased", ReservationReleased.class),
    SHIPMENT_DISPATCHED("ShipmentDispatched", ShipmentDispatched.class),
    SHIPMENT_DELIVERED("ShipmentDelivered", ShipmentDelivered.class),
    SHIPMENT_DELIVERY_FAILED("ShipmentDeliveryFailed", ShipmentDeliveryFailed.class),
    TIMEOUT("Timeout", Timeout.class);

    private static final Map<String, InboundMessageType> BY_WIRE_NAME = new HashMap<>();

    static {
        for (InboundMessageType type : values()) {
            BY_WIRE_NAME.put(type.wireName, type);
        }
    }

    private final String wireName;
    private final Class<? extends InboundMessage> messageClass;

    InboundMessageType(String wireName, Class<? extends InboundMessage> messageClass) {
        this.wireName = wireName;
        this.messageClass = messageClass;
    }

    public String wireName() {
        return wireName;
    }

    public Class<? extends InboundMessage> messageClass() {
        return messageClass;
    }

    /**
     * Resolve a type from its wire name.
     *
     * @throws IllegalArgumentException if the name is unknown
     */
    public static InboundMessageType fromWireName(String wireName) {
        InboundMessageType type = BY_WIRE_NAME.get(wireName);
        if (type == null) {
            throw new IllegalArgumentException("Unknown message type: " + wireName);
        }
        return type;
    }
}

package com.ivamare.ordersaga.domain.event;

import java.time.Instant;

/**
 * The shipment reached the customer.
 */
public record OrderDelivered(String shipmentId, Instant deliveredAt) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.ORDER_DELIVERED;
    }
}

package com.ivamare.ordersaga.domain.event;

import com.ivamare.ordersaga.domain.LineItem;
import com.ivamare.ordersaga.domain.ShippingAddress;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The order was accepted from a completed checkout.
 */
public record OrderPlaced(
    UUID orderId,
    UUID customerId,
    List<LineItem> lineItems,
    ShippingAddress shippingAddress,
    String shippingMethod,
    String paymentMethodToken,
    BigDecimal total,
    Instant placedAt
) implements SagaEvent {

    public OrderPlaced {
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
    }

    @Override
    public SagaEventType type() {
        return SagaEventType.ORDER_PLACED;
    }
}

package com.ivamare.ordersaga.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable facts captured when the order was placed.
 *
 * @param customerId Customer who placed the order
 * @param lineItems Purchased lines
 * @param total Sum of line totals plus shipping cost
 * @param shippingAddress Delivery destination
 * @param shippingMethod Selected shipping method
 * @param paymentMethodToken Reference to the customer's payment method
 * @param placedAt When checkout completed
 */
public record OrderDetails(
    UUID customerId,
    List<LineItem> lineItems,
    BigDecimal total,
    ShippingAddress shippingAddress,
    String shippingMethod,
    String paymentMethodToken,
    Instant placedAt
) {
    public OrderDetails {
        lineItems = lineItems != null ? List.copyOf(lineItems) : List.of();
    }

    /**
     * Details of an order that has not been placed yet.
     */
    public static OrderDetails none() {
        return new OrderDetails(null, List.of(), BigDecimal.ZERO, null, null, null, null);
    }
}

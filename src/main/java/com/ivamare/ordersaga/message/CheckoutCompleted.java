package com.ivamare.ordersaga.message;

import com.ivamare.ordersaga.domain.ShippingAddress;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Checkout finished in the shopping context; starts the saga.
 *
 * @param messageId Idempotency id
 * @param orderId Order identity assigned at checkout
 * @param checkoutId Checkout the order came from
 * @param customerId Customer (nullable on the wire, required by validation)
 * @param lineItems Purchased lines
 * @param shippingAddress Delivery destination
 * @param shippingMethod Selected shipping method
 * @param shippingCost Shipping cost added to the total
 * @param paymentMethodToken Customer's payment method reference
 * @param completedAt When checkout completed
 */
public record CheckoutCompleted(
    UUID messageId,
    UUID orderId,
    UUID checkoutId,
    UUID customerId,
    List<CheckoutLineItem> lineItems,
    ShippingAddress shippingAddress,
    String shippingMethod,
    BigDecimal shippingCost,
    String paymentMethodToken,
    Instant completedAt
) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.CHECKOUT_COMPLETED;
    }
}

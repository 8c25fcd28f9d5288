package com.ivamare.ordersaga.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.UUID;

/**
 * State of one order saga, obtained by folding its event stream.
 *
 * <p>Instances are immutable. The only way to get a new state is to fold a
 * {@link com.ivamare.ordersaga.domain.event.SagaEvent} onto an existing one.
 *
 * @param orderId Saga identity and correlation id of every related message
 * @param details Facts captured at placement
 * @param status Current lifecycle status
 * @param payment Payment leg
 * @param inventory Inventory leg
 * @param fulfillment Fulfillment leg
 * @param cancellationReason Reason code once cancelled (nullable)
 * @param version Stream version of the last folded event (0 for an empty stream)
 * @param pendingTimeoutToken Version at which the current wait began (nullable)
 */
public record OrderSaga(
    UUID orderId,
    OrderDetails details,
    OrderStatus status,
    PaymentProgress payment,
    InventoryProgress inventory,
    FulfillmentProgress fulfillment,
    String cancellationReason,
    long version,
    Long pendingTimeoutToken
) {
    /**
     * State of an order whose stream is empty.
     */
    public static OrderSaga empty(UUID orderId) {
        return new OrderSaga(
            orderId,
            OrderDetails.none(),
            OrderStatus.NOT_PLACED,
            PaymentProgress.unattempted(),
            InventoryProgress.unreserved(),
            FulfillmentProgress.notStarted(),
            null,
            0L,
            null
        );
    }

    public PaymentState paymentState() {
        return payment.state();
    }

    public InventoryState inventoryState() {
        return inventory.state();
    }

    public FulfillmentState fulfillmentState() {
        return fulfillment.state();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public OrderSaga withDetails(OrderDetails newDetails) {
        return new OrderSaga(orderId, newDetails, status, payment, inventory, fulfillment,
            cancellationReason, version, pendingTimeoutToken);
    }

    public OrderSaga withStatus(OrderStatus newStatus) {
        return new OrderSaga(orderId, details, newStatus, payment, inventory, fulfillment,
            cancellationReason, version, pendingTimeoutToken);
    }

    public OrderSaga withPayment(PaymentProgress newPayment) {
        return new OrderSaga(orderId, details, status, newPayment, inventory, fulfillment,
            cancellationReason, version, pendingTimeoutToken);
    }

    public OrderSaga withInventory(InventoryProgress newInventory) {
        return new OrderSaga(orderId, details, status, payment, newInventory, fulfillment,
            cancellationReason, version, pendingTimeoutToken);
    }

    public OrderSaga withFulfillment(FulfillmentProgress newFulfillment) {
        return new OrderSaga(orderId, details, status, payment, inventory, newFulfillment,
            cancellationReason, version, pendingTimeoutToken);
    }

    public OrderSaga withCancellationReason(String reason) {
        return new OrderSaga(orderId, details, status, payment, inventory, fulfillment,
            reason, version, pendingTimeoutToken);
    }

    /**
     * Create updated copy positioned at a new stream version.
     */
    public OrderSaga atVersion(long newVersion, Long timeoutToken) {
        return new OrderSaga(orderId, details, status, payment, inventory, fulfillment,
            cancellationReason, newVersion, timeoutToken);
    }
}

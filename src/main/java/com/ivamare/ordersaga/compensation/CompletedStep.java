package com.ivamare.ordersaga.compensation;

import com.ivamare.ordersaga.domain.FulfillmentState;
import com.ivamare.ordersaga.domain.InventoryState;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.domain.PaymentState;

import java.util.EnumSet;
import java.util.Set;

/**
 * Step whose effect may need to be undone when a later step fails.
 */
public enum CompletedStep {
    PAYMENT_AUTHORIZED,

    /** CapturePayment was sent; the outcome may still be in flight */
    CAPTURE_REQUESTED,

    PAYMENT_CAPTURED,
    INVENTORY_RESERVED,
    INVENTORY_COMMITTED,
    SHIPMENT_DISPATCHED;

    /**
     * Derive the completed steps from a saga state.
     */
    public static Set<CompletedStep> of(OrderSaga saga) {
        Set<CompletedStep> steps = EnumSet.noneOf(CompletedStep.class);

        PaymentState payment = saga.paymentState();
        if (payment == PaymentState.AUTHORIZED || payment == PaymentState.CAPTURED) {
            steps.add(PAYMENT_AUTHORIZED);
        }
        if (payment == PaymentState.CAPTURED) {
            steps.add(PAYMENT_CAPTURED);
            steps.add(CAPTURE_REQUESTED);
        }
        if (saga.status() == OrderStatus.CAPTURING_PAYMENT) {
            steps.add(CAPTURE_REQUESTED);
        }

        InventoryState inventory = saga.inventoryState();
        if (inventory == InventoryState.RESERVED || inventory == InventoryState.COMMITTED) {
            steps.add(INVENTORY_RESERVED);
        }
        if (inventory == InventoryState.COMMITTED) {
            steps.add(INVENTORY_COMMITTED);
        }

        if (saga.fulfillmentState() == FulfillmentState.DISPATCHED) {
            steps.add(SHIPMENT_DISPATCHED);
        }
        return steps;
    }
}

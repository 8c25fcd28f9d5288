package com.ivamare.ordersaga.decider;

import com.ivamare.ordersaga.command.SagaCommandType;
import com.ivamare.ordersaga.compensation.FailedStep;
import com.ivamare.ordersaga.domain.FulfillmentState;
import com.ivamare.ordersaga.domain.InventoryProgress;
import com.ivamare.ordersaga.domain.InventoryState;
import com.ivamare.ordersaga.domain.OrderDetails;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.domain.PaymentState;
import com.ivamare.ordersaga.domain.event.DeliveryAttemptFailed;
import com.ivamare.ordersaga.domain.event.InventoryCommitRecorded;
import com.ivamare.ordersaga.domain.event.InventoryReservationRecorded;
import com.ivamare.ordersaga.domain.event.LateCaptureRefunded;
import com.ivamare.ordersaga.domain.event.OrderCancelled;
import com.ivamare.ordersaga.domain.event.OrderPlaced;
import com.ivamare.ordersaga.domain.event.PaymentAuthorizationRecorded;
import com.ivamare.ordersaga.domain.event.PaymentCaptureRecorded;
import com.ivamare.ordersaga.domain.event.SagaEvent;
import com.ivamare.ordersaga.domain.event.ShipmentDispatchRecorded;
import com.ivamare.ordersaga.exception.ContractViolationException;

import java.util.List;

/**
 * Folds saga events into state.
 *
 * <p>Every event advances the version by exactly one. The pending timeout token is
 * the version of the last event that began a wait, so a timer fired for an older
 * wait no longer matches.
 */
public final class SagaEvolver {

    private SagaEvolver() {
    }

    /**
     * Apply a single event.
     *
     * @param state Current state
     * @param event Event to apply
     * @param version Stream version of the event, must be {@code state.version() + 1}
     * @return New state at {@code version}
     * @throws ContractViolationException if the version is not the next one
     */
    public static OrderSaga evolve(OrderSaga state, SagaEvent event, long version) {
        if (version != state.version() + 1) {
            throw new ContractViolationException(state.orderId(),
                "Event " + event.type() + " at version " + version + " does not follow version " + state.version());
        }

        OrderSaga next = switch (event.type()) {
            case ORDER_PLACED -> placed(state, (OrderPlaced) event);
            case PAYMENT_AUTHORIZED -> state
                .withPayment(state.payment().authorized(((PaymentAuthorizationRecorded) event).authorizationId()))
                .withStatus(OrderStatus.RESERVING_INVENTORY);
            case INVENTORY_RESERVED -> state
                .withInventory(new InventoryProgress(InventoryState.RESERVED,
                    ((InventoryReservationRecorded) event).reservationId()))
                .withStatus(OrderStatus.CAPTURING_PAYMENT);
            case PAYMENT_CAPTURED -> state
                .withPayment(state.payment().captured(((PaymentCaptureRecorded) event).transactionId()))
                .withStatus(OrderStatus.FULFILLING);
            case INVENTORY_COMMITTED -> committed(state, (InventoryCommitRecorded) event);
            case SHIPMENT_DISPATCHED -> dispatched(state, (ShipmentDispatchRecorded) event);
            case DELIVERY_ATTEMPT_FAILED -> failedAttempt(state, (DeliveryAttemptFailed) event);
            case ORDER_DELIVERED -> state
                .withFulfillment(state.fulfillment().withState(FulfillmentState.DELIVERED))
                .withStatus(OrderStatus.DELIVERED);
            case ORDER_CANCELLED -> cancelled(state, (OrderCancelled) event);
            case LATE_CAPTURE_REFUNDED -> state.withPayment(state.payment()
                .captured(((LateCaptureRefunded) event).transactionId())
                .withState(PaymentState.REFUNDED));
        };

        Long token = switch (event.type().waitEffect()) {
            case BEGIN -> version;
            case KEEP -> state.pendingTimeoutToken();
            case CLEAR -> null;
        };
        return next.atVersion(version, token);
    }

    /**
     * Apply events in order, numbering them after the state's version.
     */
    public static OrderSaga fold(OrderSaga state, List<SagaEvent> events) {
        OrderSaga current = state;
        for (SagaEvent event : events) {
            current = evolve(current, event, current.version() + 1);
        }
        return current;
    }

    private static OrderSaga placed(OrderSaga state, OrderPlaced event) {
        OrderDetails details = new OrderDetails(
            event.customerId(),
            event.lineItems(),
            event.total(),
            event.shippingAddress(),
            event.shippingMethod(),
            event.paymentMethodToken(),
            event.placedAt()
        );
        return state.withDetails(details).withStatus(OrderStatus.PLACED);
    }

    private static OrderSaga committed(OrderSaga state, InventoryCommitRecorded event) {
        String reservationId = event.reservationId() != null
            ? event.reservationId()
            : state.inventory().reservationId();
        return state.withInventory(new InventoryProgress(InventoryState.COMMITTED, reservationId));
    }

    private static OrderSaga failedAttempt(OrderSaga state, DeliveryAttemptFailed event) {
        return state.withFulfillment(state.fulfillment().failedAttempt(event.attempt(), event.shipmentId()));
    }

    private static OrderSaga dispatched(OrderSaga state, ShipmentDispatchRecorded event) {
        return state
            .withFulfillment(state.fulfillment().dispatched(event.shipmentId(), event.carrier(), event.trackingNumber()))
            .withStatus(OrderStatus.SHIPPED);
    }

    private static OrderSaga cancelled(OrderSaga state, OrderCancelled event) {
        OrderSaga next = state
            .withStatus(OrderStatus.CANCELLED)
            .withCancellationReason(event.reasonCode());

        FailedStep failedStep = event.failedStep();
        next = switch (failedStep) {
            case PAYMENT_AUTHORIZATION, PAYMENT_CAPTURE ->
                next.withPayment(next.payment().withState(PaymentState.FAILED));
            case INVENTORY_RESERVATION ->
                next.withInventory(next.inventory().withState(InventoryState.FAILED));
            case FULFILLMENT ->
                next.withFulfillment(next.fulfillment().withState(FulfillmentState.FAILED));
        };

        // Compensation states record that the corrective command was enqueued
        for (SagaCommandType compensation : event.compensations()) {
            if (compensation == SagaCommandType.REFUND_PAYMENT) {
                next = next.withPayment(next.payment().withState(PaymentState.REFUNDED));
            } else if (compensation == SagaCommandType.RELEASE_RESERVATION) {
                next = next.withInventory(next.inventory().withState(InventoryState.RELEASED));
            }
        }
        return next;
    }
}

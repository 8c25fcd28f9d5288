package com.ivamare.ordersaga.support;

import com.ivamare.ordersaga.decider.Decider;
import com.ivamare.ordersaga.decider.Decision;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.ShippingAddress;
import com.ivamare.ordersaga.message.CheckoutCompleted;
import com.ivamare.ordersaga.message.CheckoutLineItem;
import com.ivamare.ordersaga.message.InboundMessage;
import com.ivamare.ordersaga.message.PaymentAuthorized;
import com.ivamare.ordersaga.message.PaymentCaptureFailed;
import com.ivamare.ordersaga.message.PaymentCaptured;
import com.ivamare.ordersaga.message.PaymentFailed;
import com.ivamare.ordersaga.message.RefundCompleted;
import com.ivamare.ordersaga.message.RefundFailed;
import com.ivamare.ordersaga.message.ReservationCommitted;
import com.ivamare.ordersaga.message.ReservationConfirmed;
import com.ivamare.ordersaga.message.ReservationFailed;
import com.ivamare.ordersaga.message.ReservationReleased;
import com.ivamare.ordersaga.message.ShipmentDelivered;
import com.ivamare.ordersaga.message.ShipmentDeliveryFailed;
import com.ivamare.ordersaga.message.ShipmentDispatched;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Message builders shared by saga tests.
 *
 * <p>The default checkout has two lines (2 x 10.00 and 1 x 5.50) plus 4.50 shipping,
 * so the order total is 30.00.
 */
public final class SagaFixtures {

    public static final UUID CUSTOMER_ID = UUID.fromString("6f1f6a52-5f4e-4c1e-9a0a-3c6f8e0e2b11");
    public static final Instant COMPLETED_AT = Instant.parse("2024-05-01T10:15:30Z");
    public static final BigDecimal TOTAL = new BigDecimal("30.00");

    private SagaFixtures() {
    }

    public static ShippingAddress address() {
        return new ShippingAddress("1 Main St", null, "Springfield", "IL", "62701", "US");
    }

    public static CheckoutCompleted checkout(UUID orderId) {
        return new CheckoutCompleted(
            UUID.randomUUID(),
            orderId,
            UUID.randomUUID(),
            CUSTOMER_ID,
            List.of(
                new CheckoutLineItem("SKU-1", 2, new BigDecimal("10.00")),
                new CheckoutLineItem("SKU-2", 1, new BigDecimal("5.50"))
            ),
            address(),
            "STANDARD",
            new BigDecimal("4.50"),
            "tok_visa",
            COMPLETED_AT
        );
    }

    public static PaymentAuthorized paymentAuthorized(UUID orderId) {
        return new PaymentAuthorized(UUID.randomUUID(), orderId, "AUTH-1", TOTAL);
    }

    public static PaymentFailed paymentFailed(UUID orderId) {
        return new PaymentFailed(UUID.randomUUID(), orderId, "card declined", false);
    }

    public static ReservationConfirmed reservationConfirmed(UUID orderId) {
        return new ReservationConfirmed(UUID.randomUUID(), orderId, "RES-1");
    }

    public static ReservationFailed reservationFailed(UUID orderId) {
        return new ReservationFailed(UUID.randomUUID(), orderId, "RES-1", "out of stock");
    }

    public static PaymentCaptured paymentCaptured(UUID orderId) {
        return new PaymentCaptured(UUID.randomUUID(), orderId, "TX-1", TOTAL);
    }

    public static PaymentCaptureFailed paymentCaptureFailed(UUID orderId) {
        return new PaymentCaptureFailed(UUID.randomUUID(), orderId, "authorization expired");
    }

    public static ReservationCommitted reservationCommitted(UUID orderId) {
        return new ReservationCommitted(UUID.randomUUID(), orderId, "RES-1");
    }

    public static ShipmentDispatched shipmentDispatched(UUID orderId) {
        return shipmentDispatched(orderId, "SHIP-1");
    }

    public static ShipmentDispatched shipmentDispatched(UUID orderId, String shipmentId) {
        return new ShipmentDispatched(UUID.randomUUID(), orderId, shipmentId, "UPS", "1Z999");
    }

    public static ShipmentDelivered shipmentDelivered(UUID orderId) {
        return new ShipmentDelivered(UUID.randomUUID(), orderId, "SHIP-1", Instant.parse("2024-05-04T09:00:00Z"));
    }

    public static ShipmentDeliveryFailed deliveryFailed(UUID orderId, int attempt) {
        return new ShipmentDeliveryFailed(UUID.randomUUID(), orderId, "SHIP-1", attempt, "nobody home");
    }

    public static RefundCompleted refundCompleted(UUID orderId) {
        return new RefundCompleted(UUID.randomUUID(), orderId, "TX-1", TOTAL);
    }

    public static RefundFailed refundFailed(UUID orderId) {
        return new RefundFailed(UUID.randomUUID(), orderId, "card closed");
    }

    public static ReservationReleased reservationReleased(UUID orderId) {
        return new ReservationReleased(UUID.randomUUID(), orderId, "RES-1");
    }

    /**
     * Drive a fresh saga through the given messages, failing if any is not applied.
     */
    public static OrderSaga stateAfter(Decider decider, UUID orderId, InboundMessage... messages) {
        OrderSaga state = OrderSaga.empty(orderId);
        for (InboundMessage message : messages) {
            Decision decision = decider.decide(state, message);
            if (decision.kind() != Decision.Kind.APPLIED) {
                throw new IllegalStateException(message.type() + " was not applied: " + decision.detail());
            }
            state = decision.state();
        }
        return state;
    }

    public static OrderSaga placed(Decider decider, UUID orderId) {
        return stateAfter(decider, orderId, checkout(orderId));
    }

    public static OrderSaga reserving(Decider decider, UUID orderId) {
        return stateAfter(decider, orderId, checkout(orderId), paymentAuthorized(orderId));
    }

    public static OrderSaga capturing(Decider decider, UUID orderId) {
        return stateAfter(decider, orderId, checkout(orderId), paymentAuthorized(orderId),
            reservationConfirmed(orderId));
    }

    public static OrderSaga fulfilling(Decider decider, UUID orderId) {
        return stateAfter(decider, orderId, checkout(orderId), paymentAuthorized(orderId),
            reservationConfirmed(orderId), paymentCaptured(orderId));
    }

    public static OrderSaga shipped(Decider decider, UUID orderId) {
        return stateAfter(decider, orderId, checkout(orderId), paymentAuthorized(orderId),
            reservationConfirmed(orderId), paymentCaptured(orderId), reservationCommitted(orderId),
            shipmentDispatched(orderId));
    }
}

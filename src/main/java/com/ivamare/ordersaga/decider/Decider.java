package com.ivamare.ordersaga.decider;

import com.ivamare.ordersaga.command.NotificationType;
import com.ivamare.ordersaga.command.OrderNotification;
import com.ivamare.ordersaga.command.SagaCommand;
import com.ivamare.ordersaga.command.SagaCommandType;
import com.ivamare.ordersaga.compensation.CompensationPolicy;
import com.ivamare.ordersaga.compensation.CompletedStep;
import com.ivamare.ordersaga.compensation.FailedStep;
import com.ivamare.ordersaga.decider.Decision.Kind;
import com.ivamare.ordersaga.domain.InventoryState;
import com.ivamare.ordersaga.domain.LineItem;
import com.ivamare.ordersaga.domain.OrderDetails;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.domain.PaymentState;
import com.ivamare.ordersaga.domain.ShippingAddress;
import com.ivamare.ordersaga.domain.event.DeliveryAttemptFailed;
import com.ivamare.ordersaga.domain.event.InventoryCommitRecorded;
import com.ivamare.ordersaga.domain.event.InventoryReservationRecorded;
import com.ivamare.ordersaga.domain.event.LateCaptureRefunded;
import com.ivamare.ordersaga.domain.event.OrderCancelled;
import com.ivamare.ordersaga.domain.event.OrderDelivered;
import com.ivamare.ordersaga.domain.event.OrderPlaced;
import com.ivamare.ordersaga.domain.event.PaymentAuthorizationRecorded;
import com.ivamare.ordersaga.domain.event.PaymentCaptureRecorded;
import com.ivamare.ordersaga.domain.event.SagaEvent;
import com.ivamare.ordersaga.domain.event.ShipmentDispatchRecorded;
import com.ivamare.ordersaga.message.CheckoutCompleted;
import com.ivamare.ordersaga.message.CheckoutLineItem;
import com.ivamare.ordersaga.message.InboundMessage;
import com.ivamare.ordersaga.message.PaymentAuthorized;
import com.ivamare.ordersaga.message.PaymentCaptured;
import com.ivamare.ordersaga.message.ReservationCommitted;
import com.ivamare.ordersaga.message.ReservationConfirmed;
import com.ivamare.ordersaga.message.ShipmentDelivered;
import com.ivamare.ordersaga.message.ShipmentDeliveryFailed;
import com.ivamare.ordersaga.message.ShipmentDispatched;
import com.ivamare.ordersaga.message.Timeout;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Decides what an inbound message means for an order saga.
 *
 * <p>The decider is a pure function of (state, message): it performs no I/O, reads no
 * clock and keeps no state between calls, so replaying the same inputs always yields
 * the same decision. Persisting events and sending commands is left to the runtime.
 *
 * <p>Cancellation always goes through the {@link CompensationPolicy}, so every step that
 * completed before the failure gets its corrective command in the same decision.
 *
 * <p>Terminal sagas ignore everything except a capture that Payments completed after the
 * order was cancelled. That money is refunded.
 */
public class Decider {

    public static final String PAYMENT_DECLINED = "PAYMENT_DECLINED";
    public static final String PAYMENT_AUTHORIZATION_TIMEOUT = "PAYMENT_AUTHORIZATION_TIMEOUT";
    public static final String INVENTORY_UNAVAILABLE = "INVENTORY_UNAVAILABLE";
    public static final String INVENTORY_RESERVATION_TIMEOUT = "INVENTORY_RESERVATION_TIMEOUT";
    public static final String PAYMENT_CAPTURE_FAILED = "PAYMENT_CAPTURE_FAILED";
    public static final String PAYMENT_CAPTURE_TIMEOUT = "PAYMENT_CAPTURE_TIMEOUT";
    public static final String DELIVERY_FAILED = "DELIVERY_FAILED";
    public static final String FULFILLMENT_TIMEOUT = "FULFILLMENT_TIMEOUT";
    public static final String CAPTURED_AFTER_CANCELLATION = "CAPTURED_AFTER_CANCELLATION";

    private final DeciderSettings settings;
    private final CompensationPolicy compensationPolicy;
    private final CheckoutValidator checkoutValidator;

    public Decider() {
        this(DeciderSettings.defaults(), CompensationPolicy.defaultPolicy(), new CheckoutValidator());
    }

    public Decider(DeciderSettings settings, CompensationPolicy compensationPolicy,
                   CheckoutValidator checkoutValidator) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.compensationPolicy = Objects.requireNonNull(compensationPolicy, "compensationPolicy");
        this.checkoutValidator = Objects.requireNonNull(checkoutValidator, "checkoutValidator");
    }

    /**
     * Decide a message against the saga's current state.
     *
     * @param state Folded saga state ({@link OrderSaga#empty} for a new order)
     * @param message Inbound message for the same order
     * @return Decision; never null
     */
    public Decision decide(OrderSaga state, InboundMessage message) {
        if (!state.orderId().equals(message.orderId())) {
            return Decision.violation(state,
                message.type().wireName() + " for order " + message.orderId()
                    + " was routed to order " + state.orderId());
        }
        if (state.isTerminal()) {
            if (message instanceof PaymentCaptured captured && needsLateRefund(state)) {
                return refundLateCapture(state, captured);
            }
            return Decision.ignored(Kind.IGNORED_TERMINAL, state,
                message.type().wireName() + " after order was " + state.status());
        }
        if (state.status() == OrderStatus.NOT_PLACED && !(message instanceof CheckoutCompleted)) {
            return Decision.violation(state, message.type().wireName() + " for an order that was never placed");
        }

        return switch (message.type()) {
            case CHECKOUT_COMPLETED -> onCheckoutCompleted(state, (CheckoutCompleted) message);
            case PAYMENT_AUTHORIZED -> onPaymentAuthorized(state, (PaymentAuthorized) message);
            case PAYMENT_FAILED -> awaiting(state, OrderStatus.PLACED)
                ? cancel(state, FailedStep.PAYMENT_AUTHORIZATION, PAYMENT_DECLINED)
                : stale(state, message);
            case RESERVATION_CONFIRMED -> onReservationConfirmed(state, (ReservationConfirmed) message);
            case RESERVATION_FAILED -> state.status() == OrderStatus.PLACED
                ? unexpected(state, message)
                : cancel(state, FailedStep.INVENTORY_RESERVATION, INVENTORY_UNAVAILABLE);
            case PAYMENT_CAPTURED -> onPaymentCaptured(state, (PaymentCaptured) message);
            case PAYMENT_CAPTURE_FAILED -> onPaymentCaptureFailed(state, message);
            case RESERVATION_COMMITTED -> onReservationCommitted(state, (ReservationCommitted) message);
            case SHIPMENT_DISPATCHED -> onShipmentDispatched(state, (ShipmentDispatched) message);
            case SHIPMENT_DELIVERED -> onShipmentDelivered(state, (ShipmentDelivered) message);
            case SHIPMENT_DELIVERY_FAILED -> onShipmentDeliveryFailed(state, (ShipmentDeliveryFailed) message);
            // Compensations are only sent once the order is cancelled
            case REFUND_COMPLETED, REFUND_FAILED, RESERVATION_RELEASED -> unexpected(state, message);
            case TIMEOUT -> onTimeout(state, (Timeout) message);
        };
    }

    // ========== Placement ==========

    private Decision onCheckoutCompleted(OrderSaga state, CheckoutCompleted checkout) {
        if (state.status() != OrderStatus.NOT_PLACED) {
            return Decision.ignored(Kind.IGNORED_DUPLICATE, state,
                "Order already placed from checkout " + checkout.checkoutId());
        }

        List<Problem> problems = checkoutValidator.validate(checkout);
        if (!problems.isEmpty()) {
            return Decision.rejected(state, problems);
        }

        List<LineItem> lineItems = new ArrayList<>();
        BigDecimal total = checkout.shippingCost();
        for (CheckoutLineItem item : checkout.lineItems()) {
            LineItem line = LineItem.of(item.sku(), item.quantity(), item.priceAtPurchase());
            lineItems.add(line);
            total = total.add(line.lineTotal());
        }

        OrderPlaced placed = new OrderPlaced(
            checkout.orderId(),
            checkout.customerId(),
            lineItems,
            checkout.shippingAddress(),
            checkout.shippingMethod(),
            checkout.paymentMethodToken(),
            total,
            checkout.completedAt()
        );

        SagaCommand authorize = command(SagaCommandType.AUTHORIZE_PAYMENT, state.orderId(),
            "orderId", state.orderId(),
            "customerId", checkout.customerId(),
            "amount", total,
            "paymentMethodToken", checkout.paymentMethodToken());

        OrderNotification notification = new OrderNotification(
            NotificationType.ORDER_PLACED, state.orderId(), checkout.customerId(), null);

        return apply(state, List.of(placed), List.of(authorize), List.of(notification));
    }

    // ========== Payment authorization -> inventory reservation ==========

    private Decision onPaymentAuthorized(OrderSaga state, PaymentAuthorized message) {
        if (!awaiting(state, OrderStatus.PLACED)) {
            return stale(state, message);
        }

        List<Map<String, Object>> items = new ArrayList<>();
        for (LineItem item : state.details().lineItems()) {
            items.add(data("sku", item.sku(), "quantity", item.quantity()));
        }
        SagaCommand reserve = command(SagaCommandType.RESERVE_INVENTORY, state.orderId(),
            "orderId", state.orderId(),
            "items", items);

        return apply(state,
            List.of(new PaymentAuthorizationRecorded(message.authorizationId(), message.amount())),
            List.of(reserve),
            List.of());
    }

    // ========== Inventory reservation -> payment capture ==========

    private Decision onReservationConfirmed(OrderSaga state, ReservationConfirmed message) {
        if (state.status() == OrderStatus.PLACED) {
            return unexpected(state, message);
        }
        if (!awaiting(state, OrderStatus.RESERVING_INVENTORY)) {
            return stale(state, message);
        }

        SagaCommand capture = command(SagaCommandType.CAPTURE_PAYMENT, state.orderId(),
            "orderId", state.orderId(),
            "authorizationId", state.payment().authorizationId(),
            "amount", state.details().total());

        return apply(state,
            List.of(new InventoryReservationRecorded(message.reservationId())),
            List.of(capture),
            List.of());
    }

    // ========== Payment capture -> fulfillment ==========

    private Decision onPaymentCaptured(OrderSaga state, PaymentCaptured message) {
        if (before(state, OrderStatus.CAPTURING_PAYMENT)) {
            return unexpected(state, message);
        }
        if (!awaiting(state, OrderStatus.CAPTURING_PAYMENT)) {
            return stale(state, message);
        }

        OrderDetails details = state.details();
        SagaCommand commit = command(SagaCommandType.COMMIT_RESERVATION, state.orderId(),
            "orderId", state.orderId(),
            "reservationId", state.inventory().reservationId());

        List<Map<String, Object>> items = new ArrayList<>();
        for (LineItem item : details.lineItems()) {
            items.add(data("sku", item.sku(), "quantity", item.quantity()));
        }
        SagaCommand fulfill = command(SagaCommandType.REQUEST_FULFILLMENT, state.orderId(),
            "orderId", state.orderId(),
            "customerId", details.customerId(),
            "shippingAddress", address(details.shippingAddress()),
            "items", items,
            "shippingMethod", details.shippingMethod());

        return apply(state,
            List.of(new PaymentCaptureRecorded(message.transactionId(), message.amount())),
            List.of(commit, fulfill),
            List.of());
    }

    private Decision onPaymentCaptureFailed(OrderSaga state, InboundMessage message) {
        if (before(state, OrderStatus.CAPTURING_PAYMENT)) {
            return unexpected(state, message);
        }
        if (!awaiting(state, OrderStatus.CAPTURING_PAYMENT)) {
            return stale(state, message);
        }
        return cancel(state, FailedStep.PAYMENT_CAPTURE, PAYMENT_CAPTURE_FAILED);
    }

    // ========== Fulfillment ==========

    private Decision onReservationCommitted(OrderSaga state, ReservationCommitted message) {
        if (before(state, OrderStatus.FULFILLING)) {
            return unexpected(state, message);
        }
        if (state.inventoryState() == InventoryState.COMMITTED) {
            return stale(state, message);
        }
        return apply(state, List.of(new InventoryCommitRecorded(message.reservationId())), List.of(), List.of());
    }

    private Decision onShipmentDispatched(OrderSaga state, ShipmentDispatched message) {
        if (before(state, OrderStatus.FULFILLING)) {
            return unexpected(state, message);
        }
        if (state.status() == OrderStatus.SHIPPED
                && Objects.equals(state.fulfillment().shipmentId(), message.shipmentId())) {
            return stale(state, message);
        }
        return apply(state,
            List.of(new ShipmentDispatchRecorded(message.shipmentId(), message.carrier(), message.trackingNumber())),
            List.of(),
            List.of());
    }

    private Decision onShipmentDelivered(OrderSaga state, ShipmentDelivered message) {
        if (before(state, OrderStatus.FULFILLING)) {
            return unexpected(state, message);
        }
        String shipmentId = message.shipmentId() != null ? message.shipmentId() : state.fulfillment().shipmentId();
        OrderNotification notification = new OrderNotification(
            NotificationType.ORDER_DELIVERED, state.orderId(), state.details().customerId(), null);
        return apply(state,
            List.of(new OrderDelivered(shipmentId, message.deliveredAt())),
            List.of(),
            List.of(notification));
    }

    private Decision onShipmentDeliveryFailed(OrderSaga state, ShipmentDeliveryFailed message) {
        if (before(state, OrderStatus.FULFILLING)) {
            return unexpected(state, message);
        }
        // Without an attempt number, a shipment that already failed cannot fail again
        if (message.attempt() <= 0 && message.shipmentId() != null
                && message.shipmentId().equals(state.fulfillment().lastFailedShipmentId())) {
            return Decision.ignored(Kind.IGNORED_STALE, state,
                "Failure of shipment " + message.shipmentId() + " already recorded");
        }
        String shipmentId = message.shipmentId() != null ? message.shipmentId() : state.fulfillment().shipmentId();
        return deliveryFailure(state, message.attempt(), shipmentId, message.reason(), DELIVERY_FAILED);
    }

    /**
     * Redispatch while attempts remain, otherwise cancel with full compensation.
     *
     * @param reportedAttempt Attempt number from the message, or 0 to count on from the saga
     */
    private Decision deliveryFailure(OrderSaga state, int reportedAttempt, String shipmentId,
                                     String reason, String reasonCode) {
        int recorded = state.fulfillment().failedAttempts();
        if (reportedAttempt > 0 && reportedAttempt <= recorded) {
            return Decision.ignored(Kind.IGNORED_STALE, state,
                "Delivery attempt " + reportedAttempt + " already recorded");
        }
        int attempt = reportedAttempt > 0 ? reportedAttempt : recorded + 1;

        if (attempt >= settings.maxDeliveryAttempts()) {
            return cancel(state, FailedStep.FULFILLMENT, reasonCode);
        }

        SagaCommand redispatch = command(SagaCommandType.REQUEST_REDISPATCH, state.orderId(),
            "orderId", state.orderId(),
            "shipmentId", shipmentId,
            "attempt", attempt + 1);

        return apply(state,
            List.of(new DeliveryAttemptFailed(attempt, shipmentId, reason)),
            List.of(redispatch),
            List.of());
    }

    // ========== Timeouts ==========

    private Decision onTimeout(OrderSaga state, Timeout timeout) {
        Long pending = state.pendingTimeoutToken();
        if (pending == null || pending != timeout.token()) {
            return Decision.ignored(Kind.IGNORED_STALE, state,
                "Timeout token " + timeout.token() + " does not match pending wait " + pending);
        }

        return switch (state.status()) {
            case PLACED -> cancel(state, FailedStep.PAYMENT_AUTHORIZATION, PAYMENT_AUTHORIZATION_TIMEOUT);
            case RESERVING_INVENTORY -> cancel(state, FailedStep.INVENTORY_RESERVATION, INVENTORY_RESERVATION_TIMEOUT);
            case CAPTURING_PAYMENT -> cancel(state, FailedStep.PAYMENT_CAPTURE, PAYMENT_CAPTURE_TIMEOUT);
            case FULFILLING, SHIPPED -> deliveryFailure(state, 0, state.fulfillment().shipmentId(),
                "No fulfillment progress within SLA", FULFILLMENT_TIMEOUT);
            default -> Decision.ignored(Kind.IGNORED_STALE, state, "Nothing awaited in " + state.status());
        };
    }

    // ========== Cancellation ==========

    private static boolean needsLateRefund(OrderSaga state) {
        PaymentState payment = state.payment().state();
        return state.status() == OrderStatus.CANCELLED
            && payment != PaymentState.CAPTURED
            && payment != PaymentState.REFUNDED;
    }

    private Decision refundLateCapture(OrderSaga state, PaymentCaptured message) {
        LateCaptureRefunded event = new LateCaptureRefunded(message.transactionId(), message.amount());
        OrderSaga next = SagaEvolver.fold(state, List.of(event));
        SagaCommand refund = command(SagaCommandType.REFUND_PAYMENT, state.orderId(),
            "orderId", state.orderId(),
            "authorizationId", next.payment().authorizationId(),
            "transactionId", message.transactionId(),
            "amount", message.amount() != null ? message.amount() : state.details().total(),
            "reason", CAPTURED_AFTER_CANCELLATION);
        return Decision.applied(next, List.of(event), List.of(refund), List.of());
    }

    private Decision cancel(OrderSaga state, FailedStep failedStep, String reasonCode) {
        List<SagaCommandType> compensations =
            compensationPolicy.compensationsFor(failedStep, CompletedStep.of(state));

        List<SagaCommand> commands = new ArrayList<>();
        for (SagaCommandType compensation : compensations) {
            commands.add(compensationCommand(state, compensation, reasonCode));
        }

        OrderNotification notification = new OrderNotification(
            NotificationType.ORDER_CANCELLED, state.orderId(), state.details().customerId(), reasonCode);

        return apply(state,
            List.of(new OrderCancelled(failedStep, reasonCode, compensations)),
            commands,
            List.of(notification));
    }

    private SagaCommand compensationCommand(OrderSaga state, SagaCommandType type, String reasonCode) {
        return switch (type) {
            case REFUND_PAYMENT -> command(type, state.orderId(),
                "orderId", state.orderId(),
                "authorizationId", state.payment().authorizationId(),
                "transactionId", state.payment().transactionId(),
                "amount", state.details().total(),
                "reason", reasonCode);
            case RELEASE_RESERVATION -> command(type, state.orderId(),
                "orderId", state.orderId(),
                "reservationId", state.inventory().reservationId(),
                "reason", reasonCode);
            default -> throw new IllegalStateException(type + " is not a compensating command");
        };
    }

    // ========== Helpers ==========

    private Decision apply(OrderSaga state, List<SagaEvent> events,
                           List<SagaCommand> commands, List<OrderNotification> notifications) {
        return Decision.applied(SagaEvolver.fold(state, events), events, commands, notifications);
    }

    private static boolean awaiting(OrderSaga state, OrderStatus status) {
        return state.status() == status;
    }

    private static boolean before(OrderSaga state, OrderStatus status) {
        return state.status().compareTo(status) < 0;
    }

    private static Decision stale(OrderSaga state, InboundMessage message) {
        return Decision.ignored(Kind.IGNORED_STALE, state,
            message.type().wireName() + " arrived after order moved on to " + state.status());
    }

    private static Decision unexpected(OrderSaga state, InboundMessage message) {
        return Decision.violation(state,
            message.type().wireName() + " is not expected while order is " + state.status());
    }

    private static SagaCommand command(SagaCommandType type, UUID orderId, Object... keyValues) {
        return new SagaCommand(type, orderId, data(keyValues));
    }

    /**
     * Build a payload from key/value pairs, leaving out null values.
     */
    private static Map<String, Object> data(Object... keyValues) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                data.put((String) keyValues[i], keyValues[i + 1]);
            }
        }
        return data;
    }

    private static Map<String, Object> address(ShippingAddress address) {
        if (address == null) {
            return null;
        }
        return data(
            "street", address.street(),
            "street2", address.street2(),
            "city", address.city(),
            "state", address.state(),
            "postalCode", address.postalCode(),
            "country", address.country());
    }
}

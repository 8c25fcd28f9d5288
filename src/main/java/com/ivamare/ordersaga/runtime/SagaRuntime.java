package com.ivamare.ordersaga.runtime;

import com.ivamare.ordersaga.command.OrderNotification;
import com.ivamare.ordersaga.command.SagaCommand;
import com.ivamare.ordersaga.decider.Decider;
import com.ivamare.ordersaga.decider.Decision;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.domain.event.LateCaptureRefunded;
import com.ivamare.ordersaga.domain.event.SagaEvent;
import com.ivamare.ordersaga.exception.DatabaseExceptionClassifier;
import com.ivamare.ordersaga.exception.OrderSagaException;
import com.ivamare.ordersaga.idempotency.IdempotencyLedger;
import com.ivamare.ordersaga.message.InboundMessage;
import com.ivamare.ordersaga.message.RefundFailed;
import com.ivamare.ordersaga.message.Timeout;
import com.ivamare.ordersaga.ops.IncidentKind;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import com.ivamare.ordersaga.outbox.Outbox;
import com.ivamare.ordersaga.policy.RetryPolicy;
import com.ivamare.ordersaga.runtime.SagaOutcome.Result;
import com.ivamare.ordersaga.store.EventStore;
import com.ivamare.ordersaga.store.SnapshotStore;
import com.ivamare.ordersaga.timeout.TimeoutScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Drives an order saga: load, decide, persist, emit.
 *
 * <p>Each attempt runs in one database transaction that covers the event append,
 * the idempotency entry, the outbox writes, the timer and the optional snapshot.
 * A crash anywhere before commit leaves no trace, and redelivery of the message
 * produces the same result.
 *
 * <p>When another writer appends to the same stream first, or the database reports a
 * transient failure, the attempt is rolled back and retried from a fresh load with
 * exponential backoff. Once retries are used up an incident is raised and the message
 * is left for redelivery.
 */
public class SagaRuntime {

    private static final Logger log = LoggerFactory.getLogger(SagaRuntime.class);

    private final Decider decider;
    private final SagaLoader loader;
    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final IdempotencyLedger ledger;
    private final Outbox outbox;
    private final TimeoutScheduler timeoutScheduler;
    private final SagaIncidentQueue incidents;
    private final TransactionTemplate transactionTemplate;
    private final RetryPolicy retryPolicy;
    private final int snapshotInterval;

    public SagaRuntime(
            Decider decider,
            EventStore eventStore,
            SnapshotStore snapshotStore,
            IdempotencyLedger ledger,
            Outbox outbox,
            TimeoutScheduler timeoutScheduler,
            SagaIncidentQueue incidents,
            TransactionTemplate transactionTemplate,
            RetryPolicy retryPolicy,
            int snapshotInterval) {
        this.decider = decider;
        this.loader = new SagaLoader(eventStore, snapshotStore);
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.ledger = ledger;
        this.outbox = outbox;
        this.timeoutScheduler = timeoutScheduler;
        this.incidents = incidents;
        this.transactionTemplate = transactionTemplate;
        this.retryPolicy = retryPolicy;
        this.snapshotInterval = snapshotInterval;
    }

    /**
     * Handle a message in its own transaction.
     */
    public SagaOutcome handle(InboundMessage message) {
        return handle(message, outcome -> { });
    }

    /**
     * Handle a message, running {@code inTransaction} with the outcome before commit.
     *
     * <p>The callback lets the caller acknowledge the source message (delete or archive it)
     * atomically with the saga's writes. It is not called when retries are exhausted.
     *
     * @param message Message to handle
     * @param inTransaction Callback run inside the handling transaction
     * @return Outcome of the last attempt
     */
    public SagaOutcome handle(InboundMessage message, Consumer<SagaOutcome> inTransaction) {
        int attempt = 0;
        while (true) {
            attempt++;
            final int currentAttempt = attempt;
            try {
                return transactionTemplate.execute(status -> {
                    SagaOutcome outcome = handleOnce(message, currentAttempt);
                    inTransaction.accept(outcome);
                    return outcome;
                });
            } catch (RuntimeException e) {
                Optional<String> reason = DatabaseExceptionClassifier.retryReason(e);
                if (reason.isEmpty()) {
                    throw e;
                }
                if (!retryPolicy.shouldRetry(attempt)) {
                    return exhausted(message, attempt, reason.get(), e);
                }
                long backoff = retryPolicy.backoffMillis(attempt);
                log.debug("Retrying {} {} for order {} after {} (attempt {}/{}), backing off {}ms",
                    message.type().wireName(), message.messageId(), message.orderId(),
                    reason.get(), attempt, retryPolicy.maxAttempts(), backoff);
                sleep(backoff);
            }
        }
    }

    /**
     * Load the current state of an order saga.
     *
     * @param orderId Order identity
     * @return Folded state ({@link OrderStatus#NOT_PLACED} for an unknown order)
     */
    public OrderSaga load(UUID orderId) {
        return loader.load(orderId);
    }

    private SagaOutcome handleOnce(InboundMessage message, int attempt) {
        UUID orderId = message.orderId();
        OrderSaga state = loader.load(orderId);

        if (ledger.hasProcessed(orderId, message.messageId())) {
            log.debug("Message {} ({}) already processed for order {}",
                message.messageId(), message.type().wireName(), orderId);
            return SagaOutcome.of(message, Result.DUPLICATE, state.status(), state.version(), attempt,
                "already processed");
        }

        Decision decision = decider.decide(state, message);
        return switch (decision.kind()) {
            case APPLIED -> applied(state, message, decision, attempt);
            case IGNORED_DUPLICATE, IGNORED_STALE, IGNORED_TERMINAL -> ignored(state, message, decision, attempt);
            case REJECTED -> {
                log.warn("Rejected checkout for order {}: {}", orderId, decision.problems());
                ledger.record(orderId, message.messageId(), message.type().wireName(), state.version());
                yield SagaOutcome.of(message, Result.REJECTED, state.status(), state.version(), attempt,
                    decision.detail());
            }
            case VIOLATION -> {
                log.error("Contract violation on order {} by message {}: {}",
                    orderId, message.messageId(), decision.detail());
                incidents.raise(orderId, message.messageId(), IncidentKind.CONTRACT_VIOLATION, decision.detail());
                yield SagaOutcome.of(message, Result.VIOLATION, state.status(), state.version(), attempt,
                    decision.detail());
            }
        };
    }

    private SagaOutcome applied(OrderSaga state, InboundMessage message, Decision decision, int attempt) {
        UUID orderId = message.orderId();
        OrderSaga next = decision.state();

        eventStore.append(orderId, state.version(), decision.events(), message.messageId());
        ledger.record(orderId, message.messageId(), message.type().wireName(), next.version());

        for (SagaCommand command : decision.commands()) {
            outbox.enqueue(command, message.messageId());
        }
        for (OrderNotification notification : decision.notifications()) {
            outbox.publish(notification, message.messageId());
        }
        timeoutScheduler.scheduleFor(state, next).ifPresent(outbox::schedule);

        if (snapshotInterval > 0 && next.version() / snapshotInterval > state.version() / snapshotInterval) {
            snapshotStore.save(next);
        }

        for (SagaEvent event : decision.events()) {
            if (event instanceof LateCaptureRefunded late) {
                String detail = "Captured " + late.amount() + " (transaction " + late.transactionId()
                    + ") after the order was cancelled; refund enqueued";
                log.warn("Order {}: {}", orderId, detail);
                incidents.raise(orderId, message.messageId(), IncidentKind.LATE_CAPTURE_REFUNDED, detail);
            }
        }

        logTransition(state, next, decision);
        return SagaOutcome.of(message, Result.APPLIED, next.status(), next.version(), attempt, null);
    }

    private SagaOutcome ignored(OrderSaga state, InboundMessage message, Decision decision, int attempt) {
        if (message instanceof RefundFailed refundFailed) {
            log.warn("Refund failed for order {} ({}): {}; needs financial reconciliation",
                message.orderId(), state.status(), refundFailed.reason());
        } else if (message instanceof Timeout) {
            log.debug("Ignored timeout for order {}: {}", message.orderId(), decision.detail());
        } else {
            log.warn("Ignored {} {} for order {}: {}", message.type().wireName(), message.messageId(),
                message.orderId(), decision.detail());
        }
        ledger.record(message.orderId(), message.messageId(), message.type().wireName(), state.version());
        return SagaOutcome.of(message, Result.IGNORED, state.status(), state.version(), attempt, decision.detail());
    }

    private SagaOutcome exhausted(InboundMessage message, int attempts, String reason, RuntimeException cause) {
        String detail = "Gave up on " + message.type().wireName() + " after " + attempts
            + " attempts (" + reason + "): " + cause.getMessage();
        log.error("Retries exhausted for order {} message {}: {}",
            message.orderId(), message.messageId(), detail, cause);
        try {
            transactionTemplate.execute(status -> incidents.raise(
                message.orderId(), message.messageId(), IncidentKind.RETRY_EXHAUSTED, detail));
        } catch (DataAccessException e) {
            log.error("Could not record retry-exhausted incident for order {}", message.orderId(), e);
        }
        return SagaOutcome.of(message, Result.RETRY_EXHAUSTED, null, -1L, attempts, detail);
    }

    private void logTransition(OrderSaga before, OrderSaga after, Decision decision) {
        if (before.status() == after.status()) {
            log.debug("Order {} recorded {} event(s) in {} at version {}",
                after.orderId(), decision.events().size(), after.status(), after.version());
            return;
        }
        switch (after.status()) {
            case PLACED -> log.info("Order {} placed for customer {} with total {}",
                after.orderId(), after.details().customerId(), after.details().total());
            case DELIVERED -> log.info("Order {} delivered", after.orderId());
            case CANCELLED -> log.info("Order {} cancelled in {}: {} (compensations: {})",
                after.orderId(), before.status(), after.cancellationReason(),
                decision.commands().stream().map(c -> c.commandType().wireName()).toList());
            default -> log.debug("Order {} moved {} -> {} at version {}",
                after.orderId(), before.status(), after.status(), after.version());
        }
    }

    private static void sleep(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrderSagaException("Interrupted while backing off", e);
        }
    }
}

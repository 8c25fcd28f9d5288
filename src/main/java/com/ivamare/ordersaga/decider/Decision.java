package com.ivamare.ordersaga.decider;

import com.ivamare.ordersaga.command.OrderNotification;
import com.ivamare.ordersaga.command.SagaCommand;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.event.SagaEvent;

import java.util.List;

/**
 * Result of deciding one inbound message against the current saga state.
 *
 * @param kind What the decider concluded
 * @param state Saga state after applying {@code events} (the input state for no-ops)
 * @param events Events to append, in order
 * @param commands Participant commands to enqueue, in order
 * @param notifications Lifecycle notifications to publish
 * @param detail Why the message was ignored, rejected or refused
 * @param problems Validation problems for a rejected checkout
 */
public record Decision(
    Kind kind,
    OrderSaga state,
    List<SagaEvent> events,
    List<SagaCommand> commands,
    List<OrderNotification> notifications,
    String detail,
    List<Problem> problems
) {

    public enum Kind {
        /** New events recorded */
        APPLIED,
        /** Checkout for a saga that already exists */
        IGNORED_DUPLICATE,
        /** Reply for a step the saga has moved past, or an outdated timeout */
        IGNORED_STALE,
        /** Saga already delivered or cancelled */
        IGNORED_TERMINAL,
        /** Checkout failed validation */
        REJECTED,
        /** Message cannot occur in the current state */
        VIOLATION
    }

    public Decision {
        events = events != null ? List.copyOf(events) : List.of();
        commands = commands != null ? List.copyOf(commands) : List.of();
        notifications = notifications != null ? List.copyOf(notifications) : List.of();
        problems = problems != null ? List.copyOf(problems) : List.of();
    }

    public static Decision applied(OrderSaga state, List<SagaEvent> events,
                                   List<SagaCommand> commands, List<OrderNotification> notifications) {
        return new Decision(Kind.APPLIED, state, events, commands, notifications, null, null);
    }

    public static Decision ignored(Kind kind, OrderSaga state, String detail) {
        return new Decision(kind, state, null, null, null, detail, null);
    }

    public static Decision rejected(OrderSaga state, List<Problem> problems) {
        return new Decision(Kind.REJECTED, state, null, null, null,
            "Checkout failed validation: " + problems, problems);
    }

    public static Decision violation(OrderSaga state, String detail) {
        return new Decision(Kind.VIOLATION, state, null, null, null, detail, null);
    }

    /**
     * Whether nothing needs to be persisted or sent.
     */
    public boolean isNoOp() {
        return kind != Kind.APPLIED;
    }

    public boolean isIgnored() {
        return kind == Kind.IGNORED_DUPLICATE || kind == Kind.IGNORED_STALE || kind == Kind.IGNORED_TERMINAL;
    }
}

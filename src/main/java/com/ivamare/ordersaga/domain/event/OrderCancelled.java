package com.ivamare.ordersaga.domain.event;

import com.ivamare.ordersaga.command.SagaCommandType;
import com.ivamare.ordersaga.compensation.FailedStep;

import java.util.List;

/**
 * The order was cancelled after a step failed.
 *
 * @param failedStep Step that failed
 * @param reasonCode Machine-readable reason forwarded to notification consumers
 * @param compensations Corrective commands enqueued together with this event
 */
public record OrderCancelled(
    FailedStep failedStep,
    String reasonCode,
    List<SagaCommandType> compensations
) implements SagaEvent {

    public OrderCancelled {
        compensations = compensations != null ? List.copyOf(compensations) : List.of();
    }

    @Override
    public SagaEventType type() {
        return SagaEventType.ORDER_CANCELLED;
    }
}

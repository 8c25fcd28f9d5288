package com.ivamare.ordersaga.outbox;

import com.ivamare.ordersaga.command.OrderNotification;
import com.ivamare.ordersaga.command.SagaCommand;
import com.ivamare.ordersaga.timeout.ScheduledTimeout;

import java.util.UUID;

/**
 * Outbound side of the saga.
 *
 * <p>Implementations must write through the caller's transaction: nothing becomes
 * visible to participants unless the events that produced it are committed too.
 */
public interface Outbox {

    /**
     * Enqueue a command for a participant service.
     *
     * @param command Command to send
     * @param causationId Inbound message that produced the command
     */
    void enqueue(SagaCommand command, UUID causationId);

    /**
     * Publish an order lifecycle notification.
     */
    void publish(OrderNotification notification, UUID causationId);

    /**
     * Arrange for a timeout to be delivered back to the saga.
     */
    void schedule(ScheduledTimeout timeout);
}

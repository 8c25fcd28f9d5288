package com.ivamare.ordersaga.command;

import java.util.Map;
import java.util.UUID;

/**
 * Command produced by the decider, written to the outbox in the same transaction
 * as the events that caused it.
 *
 * @param commandType Type of command
 * @param orderId Order the command belongs to, used as correlation id
 * @param data Command payload
 */
public record SagaCommand(
    SagaCommandType commandType,
    UUID orderId,
    Map<String, Object> data
) {
    public SagaCommand {
        data = data != null ? Map.copyOf(data) : Map.of();
    }
}

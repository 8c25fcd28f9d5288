package com.ivamare.ordersaga.compensation;

import com.ivamare.ordersaga.command.SagaCommandType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup table from (failed step, completed steps) to the corrective commands
 * that must be enqueued before the saga is marked cancelled.
 *
 * <p>Default table:
 * <pre>
 * failed step            | command             | required when any of
 * -----------------------+---------------------+----------------------------------------
 * PAYMENT_AUTHORIZATION  | (none)              |
 * INVENTORY_RESERVATION  | RefundPayment       | PAYMENT_CAPTURED, CAPTURE_REQUESTED
 * PAYMENT_CAPTURE        | ReleaseReservation  | INVENTORY_RESERVED, INVENTORY_COMMITTED
 * FULFILLMENT            | ReleaseReservation  | INVENTORY_RESERVED, INVENTORY_COMMITTED
 * FULFILLMENT            | RefundPayment       | PAYMENT_CAPTURED
 * </pre>
 *
 * <p>An authorization that was never captured needs no compensation; it expires on
 * the Payments side. Release and refund touch independent services, so their order
 * in the result is only the order in which they are enqueued.
 */
public final class CompensationPolicy {

    /**
     * One row of the table.
     *
     * @param command Corrective command
     * @param triggers Completed steps of which at least one must be present
     */
    public record Entry(SagaCommandType command, Set<CompletedStep> triggers) {
        public Entry {
            triggers = Collections.unmodifiableSet(EnumSet.copyOf(triggers));
        }

        boolean appliesTo(Set<CompletedStep> completed) {
            for (CompletedStep trigger : triggers) {
                if (completed.contains(trigger)) {
                    return true;
                }
            }
            return false;
        }
    }

    private final Map<FailedStep, List<Entry>> table;

    public CompensationPolicy(Map<FailedStep, List<Entry>> table) {
        Map<FailedStep, List<Entry>> copy = new EnumMap<>(FailedStep.class);
        for (FailedStep step : FailedStep.values()) {
            copy.put(step, List.copyOf(table.getOrDefault(step, List.of())));
        }
        this.table = Collections.unmodifiableMap(copy);
    }

    /**
     * Create the policy with the default order compensation table.
     */
    public static CompensationPolicy defaultPolicy() {
        Map<FailedStep, List<Entry>> table = new EnumMap<>(FailedStep.class);
        table.put(FailedStep.PAYMENT_AUTHORIZATION, List.of());
        table.put(FailedStep.INVENTORY_RESERVATION, List.of(
            new Entry(SagaCommandType.REFUND_PAYMENT,
                EnumSet.of(CompletedStep.PAYMENT_CAPTURED, CompletedStep.CAPTURE_REQUESTED))
        ));
        table.put(FailedStep.PAYMENT_CAPTURE, List.of(
            new Entry(SagaCommandType.RELEASE_RESERVATION,
                EnumSet.of(CompletedStep.INVENTORY_RESERVED, CompletedStep.INVENTORY_COMMITTED))
        ));
        table.put(FailedStep.FULFILLMENT, List.of(
            new Entry(SagaCommandType.RELEASE_RESERVATION,
                EnumSet.of(CompletedStep.INVENTORY_RESERVED, CompletedStep.INVENTORY_COMMITTED)),
            new Entry(SagaCommandType.REFUND_PAYMENT,
                EnumSet.of(CompletedStep.PAYMENT_CAPTURED))
        ));
        return new CompensationPolicy(table);
    }

    /**
     * Look up the corrective commands for a failure.
     *
     * @param failedStep Step that failed
     * @param completed Steps completed at failure time
     * @return Ordered corrective commands (may be empty)
     */
    public List<SagaCommandType> compensationsFor(FailedStep failedStep, Set<CompletedStep> completed) {
        List<SagaCommandType> commands = new ArrayList<>();
        for (Entry entry : table.get(failedStep)) {
            if (entry.appliesTo(completed)) {
                commands.add(entry.command());
            }
        }
        return List.copyOf(commands);
    }

    /**
     * Get the rows registered for a failed step.
     */
    public List<Entry> entriesFor(FailedStep failedStep) {
        return table.get(failedStep);
    }
}

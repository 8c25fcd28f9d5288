package com.ivamare.ordersaga.ops;

/**
 * Why an operator needs to look at a saga.
 */
public enum IncidentKind {
    /** A message arrived that the saga's state does not allow */
    CONTRACT_VIOLATION,
    /** Handling kept conflicting or failing transiently; the message stays queued */
    RETRY_EXHAUSTED,
    /** An inbox payload could not be decoded and was archived */
    MALFORMED_MESSAGE,
    /** Payments captured money after the order was cancelled; check that the refund completes */
    LATE_CAPTURE_REFUNDED,
    /** A message kept failing with a non-retryable error and was archived */
    POISON_MESSAGE
}

package com.ivamare.ordersaga.command;

/**
 * Commands the saga sends to the services it coordinates.
 */
public enum SagaCommandType {
    AUTHORIZE_PAYMENT("AuthorizePayment", "payments"),
    CAPTURE_PAYMENT("CapturePayment", "payments"),
    REFUND_PAYMENT("RefundPayment", "payments"),
    RESERVE_INVENTORY("ReserveInventory", "inventory"),
    COMMIT_RESERVATION("CommitReservation", "inventory"),
    RELEASE_RESERVATION("ReleaseReservation", "inventory"),
    REQUEST_FULFILLMENT("RequestFulfillment", "fulfillment"),
    REQUEST_REDISPATCH("RequestRedispatch", "fulfillment");

    private final String wireName;
    private final String targetDomain;

    SagaCommandType(String wireName, String targetDomain) {
        this.wireName = wireName;
        this.targetDomain = targetDomain;
    }

    /**
     * Command type as it appears in the {@code command_type} field on the wire.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Domain of the service that handles this command.
     */
    public String targetDomain() {
        return targetDomain;
    }
}

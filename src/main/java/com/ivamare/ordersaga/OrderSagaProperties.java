package com.ivamare.ordersaga;

import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.pgmq.QueueNames;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Configuration properties for the order saga.
 *
 * <p>Example configuration:
 * <pre>
 * ordersaga:
 *   enabled: true
 *   inbox-queue: orders__saga_inbox
 *   max-delivery-attempts: 3
 *   snapshot-interval: 50
 *   retry:
 *     max-attempts: 5
 *     initial-backoff-ms: 20
 *     max-backoff-ms: 1000
 *     backoff-multiplier: 2.0
 *   timeouts:
 *     payment-authorization: 10m
 *     inventory-reservation: 30s
 *     payment-capture: 5m
 *     fulfillment-dispatch: 2d
 *     delivery-confirmation: 5d
 *   router:
 *     enabled: true
 *     auto-start: true
 *     concurrency: 8
 * </pre>
 */
@ConfigurationProperties(prefix = "ordersaga")
public class OrderSagaProperties {

    /**
     * Enable/disable order saga auto-configuration.
     */
    private boolean enabled = true;

    /**
     * Queue receiving participant replies, checkout events and timeouts.
     */
    private String inboxQueue = QueueNames.DEFAULT_INBOX;

    /**
     * Failed delivery attempts after which the order is cancelled.
     */
    private int maxDeliveryAttempts = 3;

    /**
     * Write a snapshot every this many events (0 disables snapshots).
     */
    private int snapshotInterval = 50;

    private RetryProperties retry = new RetryProperties();

    private TimeoutProperties timeouts = new TimeoutProperties();

    private RouterProperties router = new RouterProperties();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getInboxQueue() {
        return inboxQueue;
    }

    public void setInboxQueue(String inboxQueue) {
        this.inboxQueue = inboxQueue;
    }

    public int getMaxDeliveryAttempts() {
        return maxDeliveryAttempts;
    }

    public void setMaxDeliveryAttempts(int maxDeliveryAttempts) {
        this.maxDeliveryAttempts = maxDeliveryAttempts;
    }

    public int getSnapshotInterval() {
        return snapshotInterval;
    }

    public void setSnapshotInterval(int snapshotInterval) {
        this.snapshotInterval = snapshotInterval;
    }

    public RetryProperties getRetry() {
        return retry;
    }

    public void setRetry(RetryProperties retry) {
        this.retry = retry;
    }

    public TimeoutProperties getTimeouts() {
        return timeouts;
    }

    public void setTimeouts(TimeoutProperties timeouts) {
        this.timeouts = timeouts;
    }

    public RouterProperties getRouter() {
        return router;
    }

    public void setRouter(RouterProperties router) {
        this.router = router;
    }

    /**
     * Retry of handling attempts that hit a stream conflict or a transient database error.
     */
    public static class RetryProperties {

        private int maxAttempts = 5;

        private long initialBackoffMs = 20;

        private long maxBackoffMs = 1000;

        private double backoffMultiplier = 2.0;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialBackoffMs() {
            return initialBackoffMs;
        }

        public void setInitialBackoffMs(long initialBackoffMs) {
            this.initialBackoffMs = initialBackoffMs;
        }

        public long getMaxBackoffMs() {
            return maxBackoffMs;
        }

        public void setMaxBackoffMs(long maxBackoffMs) {
            this.maxBackoffMs = maxBackoffMs;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }
    }

    /**
     * SLA windows for each awaited response.
     */
    public static class TimeoutProperties {

        /** Waiting for PaymentAuthorized in PLACED */
        private Duration paymentAuthorization = Duration.ofMinutes(10);

        /** Waiting for ReservationConfirmed in RESERVING_INVENTORY */
        private Duration inventoryReservation = Duration.ofSeconds(30);

        /** Waiting for PaymentCaptured in CAPTURING_PAYMENT */
        private Duration paymentCapture = Duration.ofMinutes(5);

        /** Waiting for ShipmentDispatched in FULFILLING */
        private Duration fulfillmentDispatch = Duration.ofDays(2);

        /** Waiting for ShipmentDelivered in SHIPPED */
        private Duration deliveryConfirmation = Duration.ofDays(5);

        /**
         * SLA windows keyed by the status that awaits them.
         */
        public Map<OrderStatus, Duration> asMap() {
            Map<OrderStatus, Duration> windows = new EnumMap<>(OrderStatus.class);
            windows.put(OrderStatus.PLACED, paymentAuthorization);
            windows.put(OrderStatus.RESERVING_INVENTORY, inventoryReservation);
            windows.put(OrderStatus.CAPTURING_PAYMENT, paymentCapture);
            windows.put(OrderStatus.FULFILLING, fulfillmentDispatch);
            windows.put(OrderStatus.SHIPPED, deliveryConfirmation);
            return windows;
        }

        public Duration getPaymentAuthorization() {
            return paymentAuthorization;
        }

        public void setPaymentAuthorization(Duration paymentAuthorization) {
            this.paymentAuthorization = paymentAuthorization;
        }

        public Duration getInventoryReservation() {
            return inventoryReservation;
        }

        public void setInventoryReservation(Duration inventoryReservation) {
            this.inventoryReservation = inventoryReservation;
        }

        public Duration getPaymentCapture() {
            return paymentCapture;
        }

        public void setPaymentCapture(Duration paymentCapture) {
            this.paymentCapture = paymentCapture;
        }

        public Duration getFulfillmentDispatch() {
            return fulfillmentDispatch;
        }

        public void setFulfillmentDispatch(Duration fulfillmentDispatch) {
            this.fulfillmentDispatch = fulfillmentDispatch;
        }

        public Duration getDeliveryConfirmation() {
            return deliveryConfirmation;
        }

        public void setDeliveryConfirmation(Duration deliveryConfirmation) {
            this.deliveryConfirmation = deliveryConfirmation;
        }
    }

    /**
     * Inbox router configuration.
     */
    public static class RouterProperties {

        /**
         * Create the SagaMessageRouter bean.
         */
        private boolean enabled = false;

        /**
         * Start the router once the application is ready.
         */
        private boolean autoStart = false;

        /**
         * Seconds a read message stays invisible to other readers.
         */
        private int visibilityTimeout = 30;

        /**
         * Maximum messages handled at once.
         */
        private int concurrency = 8;

        /**
         * Poll interval (and LISTEN wait) in milliseconds.
         */
        private long pollIntervalMs = 1000;

        /**
         * Wake up on pg_notify instead of polling only.
         */
        private boolean useNotify = true;

        /**
         * Archive handled messages instead of deleting them.
         */
        private boolean archiveMessages = false;

        /**
         * Reads after which a message that keeps failing unexpectedly is archived with an incident.
         */
        private int maxReadCount = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isAutoStart() {
            return autoStart;
        }

        public void setAutoStart(boolean autoStart) {
            this.autoStart = autoStart;
        }

        public int getVisibilityTimeout() {
            return visibilityTimeout;
        }

        public void setVisibilityTimeout(int visibilityTimeout) {
            this.visibilityTimeout = visibilityTimeout;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public boolean isUseNotify() {
            return useNotify;
        }

        public void setUseNotify(boolean useNotify) {
            this.useNotify = useNotify;
        }

        public boolean isArchiveMessages() {
            return archiveMessages;
        }

        public void setArchiveMessages(boolean archiveMessages) {
            this.archiveMessages = archiveMessages;
        }

        public int getMaxReadCount() {
            return maxReadCount;
        }

        public void setMaxReadCount(int maxReadCount) {
            this.maxReadCount = maxReadCount;
        }
    }
}

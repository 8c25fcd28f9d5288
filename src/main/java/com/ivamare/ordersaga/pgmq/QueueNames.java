package com.ivamare.ordersaga.pgmq;

/**
 * Queue naming conventions.
 *
 * <p>Queue names follow the pattern {domain}__{suffix}.
 */
public final class QueueNames {

    private QueueNames() {
    }

    /** Suffix for participant command queues */
    public static final String COMMANDS_SUFFIX = "commands";

    /** Suffix for lifecycle notification queues */
    public static final String NOTIFICATIONS_SUFFIX = "notifications";

    /** Prefix for NOTIFY channel names */
    public static final String NOTIFY_PREFIX = "pgmq_notify";

    public static final String SEPARATOR = "__";

    /** Domain owning the saga's own queues */
    public static final String ORDERS_DOMAIN = "orders";

    /** Default inbox for participant replies, checkout events and timeouts */
    public static final String DEFAULT_INBOX = ORDERS_DOMAIN + SEPARATOR + "saga_inbox";

    /**
     * Create command queue name from domain.
     *
     * @param domain The domain name, e.g. payments
     * @return Queue name in format {domain}__commands
     */
    public static String commandQueue(String domain) {
        return domain + SEPARATOR + COMMANDS_SUFFIX;
    }

    /**
     * Queue carrying order lifecycle notifications.
     */
    public static String notificationQueue() {
        return ORDERS_DOMAIN + SEPARATOR + NOTIFICATIONS_SUFFIX;
    }

    /**
     * LISTEN/NOTIFY channel of a queue. Characters other than letters, digits and
     * underscores are replaced, so the result can be used as an unquoted identifier.
     *
     * @param queueName The queue name
     * @return Channel name in format pgmq_notify_{queueName}
     */
    public static String notifyChannel(String queueName) {
        return (NOTIFY_PREFIX + "_" + queueName).replaceAll("[^a-zA-Z0-9_]", "_");
    }
}

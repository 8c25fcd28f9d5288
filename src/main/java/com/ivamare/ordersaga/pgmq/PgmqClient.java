package com.ivamare.ordersaga.pgmq;

import java.util.List;
import java.util.Map;

/**
 * Client for the PGMQ queues the saga reads from and writes to.
 *
 * <p>Every call runs on the caller's connection, so sends made while handling a
 * message commit or roll back together with the saga's own writes. Queues are
 * created by the schema script, not by the client.
 */
public interface PgmqClient {

    /**
     * Send a message to a queue.
     *
     * @param queueName Name of the queue
     * @param message Message payload (will be JSON serialized)
     * @return Message ID assigned by PGMQ
     */
    default long send(String queueName, Map<String, Object> message) {
        return send(queueName, message, 0);
    }

    /**
     * Send a message that stays invisible for a while. Used for timeout timers.
     *
     * @param queueName Name of the queue
     * @param message Message payload (will be JSON serialized)
     * @param delaySeconds Delay in seconds before message becomes visible
     * @return Message ID assigned by PGMQ
     */
    long send(String queueName, Map<String, Object> message, int delaySeconds);

    /**
     * Wake up listeners of a queue.
     *
     * @param queueName Name of the queue
     */
    void notify(String queueName);

    /**
     * Read messages, hiding them from other readers for the visibility timeout.
     *
     * @param queueName Name of the queue
     * @param visibilityTimeoutSeconds How long read messages stay invisible
     * @param batchSize Maximum number of messages
     * @return Messages read (may be empty)
     */
    List<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds, int batchSize);

    /**
     * Delete a message.
     *
     * @return true if the message existed
     */
    boolean delete(String queueName, long msgId);

    /**
     * Move a message to the queue's archive table.
     *
     * @return true if the message existed
     */
    boolean archive(String queueName, long msgId);
}

package com.ivamare.ordersaga.outbox.impl;

import com.ivamare.ordersaga.command.OrderNotification;
import com.ivamare.ordersaga.command.SagaCommand;
import com.ivamare.ordersaga.message.InboundMessageCodec;
import com.ivamare.ordersaga.outbox.Outbox;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.pgmq.QueueNames;
import com.ivamare.ordersaga.timeout.ScheduledTimeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Outbox over PGMQ queues living in the saga's own database.
 *
 * <p>Commands go to {@code {domain}__commands} with the participant's reply addressed
 * to the saga inbox. Notifications go to {@code orders__notifications}. Timeouts are
 * sent to the inbox with a visibility delay equal to their SLA window.
 *
 * <p>Command ids are derived from the causing message and the command type, so a
 * retried handling attempt sends commands with the same ids.
 */
public class PgmqOutbox implements Outbox {

    private static final Logger log = LoggerFactory.getLogger(PgmqOutbox.class);

    private final PgmqClient pgmqClient;
    private final InboundMessageCodec codec;
    private final String inboxQueue;

    public PgmqOutbox(PgmqClient pgmqClient, InboundMessageCodec codec, String inboxQueue) {
        this.pgmqClient = pgmqClient;
        this.codec = codec;
        this.inboxQueue = inboxQueue;
    }

    @Override
    public void enqueue(SagaCommand command, UUID causationId) {
        String domain = command.commandType().targetDomain();
        String queue = QueueNames.commandQueue(domain);
        UUID commandId = commandId(causationId, command.commandType().wireName());

        Map<String, Object> message = new HashMap<>();
        message.put("domain", domain);
        message.put("command_type", command.commandType().wireName());
        message.put("command_id", commandId.toString());
        message.put("correlation_id", command.orderId().toString());
        message.put("causation_id", causationId.toString());
        message.put("reply_to", inboxQueue);
        message.put("data", command.data());

        long msgId = pgmqClient.send(queue, message);
        log.debug("Enqueued {} for order {} to {}: commandId={}, msgId={}",
            command.commandType().wireName(), command.orderId(), queue, commandId, msgId);
    }

    @Override
    public void publish(OrderNotification notification, UUID causationId) {
        String queue = QueueNames.notificationQueue();

        Map<String, Object> message = new HashMap<>();
        message.put("event_type", notification.type().wireName());
        message.put("event_id", commandId(causationId, notification.type().wireName()).toString());
        message.put("order_id", notification.orderId().toString());
        if (notification.customerId() != null) {
            message.put("customer_id", notification.customerId().toString());
        }
        if (notification.reasonCode() != null) {
            message.put("reason_code", notification.reasonCode());
        }
        message.put("published_at", Instant.now().toString());

        pgmqClient.send(queue, message);
        log.debug("Published {} for order {}", notification.type().wireName(), notification.orderId());
    }

    @Override
    public void schedule(ScheduledTimeout timeout) {
        long seconds = Math.max(0, Math.min(Integer.MAX_VALUE, timeout.delay().toSeconds()));
        pgmqClient.send(inboxQueue, codec.encode(timeout.toMessage()), (int) seconds);
        log.debug("Scheduled timeout for order {} awaiting {} (token={}) in {}s",
            timeout.orderId(), timeout.awaitedStatus(), timeout.token(), seconds);
    }

    private static UUID commandId(UUID causationId, String name) {
        return UUID.nameUUIDFromBytes((causationId + "/" + name).getBytes(StandardCharsets.UTF_8));
    }
}

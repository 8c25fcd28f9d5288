package com.ivamare.ordersaga.outbox.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersaga.command.NotificationType;
import com.ivamare.ordersaga.command.OrderNotification;
import com.ivamare.ordersaga.command.SagaCommand;
import com.ivamare.ordersaga.command.SagaCommandType;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.message.InboundMessageCodec;
import com.ivamare.ordersaga.message.Timeout;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.pgmq.QueueNames;
import com.ivamare.ordersaga.timeout.ScheduledTimeout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("PgmqOutbox")
class PgmqOutboxTest {

    private PgmqClient pgmqClient;
    private InboundMessageCodec codec;
    private PgmqOutbox outbox;

    private final UUID orderId = UUID.randomUUID();
    private final UUID causationId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        pgmqClient = mock(PgmqClient.class);
        codec = new InboundMessageCodec(new ObjectMapper());
        outbox = new PgmqOutbox(pgmqClient, codec, QueueNames.DEFAULT_INBOX);
    }

    @Test
    @DisplayName("should send command to the target domain with reply addressed to the inbox")
    @SuppressWarnings("unchecked")
    void shouldSendCommand() {
        SagaCommand capture = new SagaCommand(SagaCommandType.CAPTURE_PAYMENT, orderId,
            Map.of("orderId", orderId, "authorizationId", "AUTH-1"));

        outbox.enqueue(capture, causationId);

        ArgumentCaptor<Map<String, Object>> messageCaptor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient).send(eq("payments__commands"), messageCaptor.capture());
        Map<String, Object> message = messageCaptor.getValue();
        assertEquals("payments", message.get("domain"));
        assertEquals("CapturePayment", message.get("command_type"));
        assertEquals(orderId.toString(), message.get("correlation_id"));
        assertEquals(causationId.toString(), message.get("causation_id"));
        assertEquals("orders__saga_inbox", message.get("reply_to"));
        assertEquals(capture.data(), message.get("data"));
    }

    @Test
    @DisplayName("same cause and command type give the same command id")
    @SuppressWarnings("unchecked")
    void shouldDeriveStableCommandIds() {
        SagaCommand release = new SagaCommand(SagaCommandType.RELEASE_RESERVATION, orderId, Map.of());
        SagaCommand refund = new SagaCommand(SagaCommandType.REFUND_PAYMENT, orderId, Map.of());

        outbox.enqueue(release, causationId);
        outbox.enqueue(release, causationId);
        outbox.enqueue(refund, causationId);

        ArgumentCaptor<Map<String, Object>> messageCaptor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient, times(2)).send(eq("inventory__commands"), messageCaptor.capture());
        verify(pgmqClient).send(eq("payments__commands"), messageCaptor.capture());
        var ids = messageCaptor.getAllValues().stream().map(m -> m.get("command_id")).toList();
        assertEquals(ids.get(0), ids.get(1));
        assertNotEquals(ids.get(0), ids.get(2));
    }

    @Test
    @DisplayName("should publish notification with reason code")
    @SuppressWarnings("unchecked")
    void shouldPublishNotification() {
        outbox.publish(new OrderNotification(NotificationType.ORDER_CANCELLED, orderId, null, "PAYMENT_DECLINED"),
            causationId);

        ArgumentCaptor<Map<String, Object>> messageCaptor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient).send(eq("orders__notifications"), messageCaptor.capture());
        Map<String, Object> message = messageCaptor.getValue();
        assertEquals("OrderCancelled", message.get("event_type"));
        assertEquals("PAYMENT_DECLINED", message.get("reason_code"));
        assertFalse(message.containsKey("customer_id"));
        assertNotNull(message.get("published_at"));
    }

    @Test
    @DisplayName("should schedule timeout as a delayed inbox message")
    @SuppressWarnings("unchecked")
    void shouldScheduleTimeout() {
        ScheduledTimeout timeout = new ScheduledTimeout(orderId, 3, OrderStatus.CAPTURING_PAYMENT,
            Duration.ofMinutes(5));

        outbox.schedule(timeout);

        ArgumentCaptor<Map<String, Object>> messageCaptor = ArgumentCaptor.forClass(Map.class);
        verify(pgmqClient).send(eq("orders__saga_inbox"), messageCaptor.capture(), eq(300));
        Timeout decoded = (Timeout) codec.decode(messageCaptor.getValue());
        assertEquals(timeout.toMessage(), decoded);
    }
}

package com.ivamare.ordersaga.router;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.exception.ContractViolationException;
import com.ivamare.ordersaga.message.InboundMessage;
import com.ivamare.ordersaga.message.InboundMessageCodec;
import com.ivamare.ordersaga.message.PaymentAuthorized;
import com.ivamare.ordersaga.ops.IncidentKind;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.pgmq.PgmqMessage;
import com.ivamare.ordersaga.runtime.SagaOutcome;
import com.ivamare.ordersaga.runtime.SagaOutcome.Result;
import com.ivamare.ordersaga.runtime.SagaRuntime;
import com.ivamare.ordersaga.support.SagaFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@DisplayName("SagaMessageRouter")
class SagaMessageRouterTest {

    private static final String INBOX = "orders__saga_inbox";

    private DataSource dataSource;
    private TransactionTemplate transactionTemplate;
    private SagaRuntime runtime;
    private InboundMessageCodec codec;
    private SagaIncidentQueue incidents;
    private PgmqClient pgmqClient;
    private SagaMessageRouter router;

    @BeforeEach
    void setUp() {
        dataSource = mock(DataSource.class);
        transactionTemplate = mock(TransactionTemplate.class);
        runtime = mock(SagaRuntime.class);
        codec = new InboundMessageCodec(new ObjectMapper());
        incidents = mock(SagaIncidentQueue.class);
        pgmqClient = mock(PgmqClient.class);
        router = router(false);

        doAnswer(inv -> {
            Consumer<Object> callback = inv.getArgument(0);
            callback.accept(null);
            return null;
        }).when(transactionTemplate).executeWithoutResult(any());
    }

    @AfterEach
    void tearDown() {
        router.stopNow();
    }

    private SagaMessageRouter router(boolean archiveMessages) {
        return new SagaMessageRouter(dataSource, transactionTemplate, runtime, codec, incidents, pgmqClient,
            INBOX, 30, 2, 50, false, archiveMessages, 3);
    }

    private PgmqMessage inboxMessage(long msgId, InboundMessage message) {
        return new PgmqMessage(msgId, 1, Instant.now(), Instant.now(), codec.encode(message));
    }

    /**
     * Make the runtime return {@code result}, acknowledging inside the "transaction" unless retries ran out.
     */
    @SuppressWarnings("unchecked")
    private void runtimeReturns(Result result) {
        when(runtime.handle(any(InboundMessage.class), any(Consumer.class))).thenAnswer(inv -> {
            InboundMessage message = inv.getArgument(0);
            SagaOutcome outcome = new SagaOutcome(message.orderId(), message.messageId(), result,
                result == Result.RETRY_EXHAUSTED ? null : OrderStatus.RESERVING_INVENTORY,
                result == Result.RETRY_EXHAUSTED ? -1 : 2, 1, null);
            if (outcome.isSettled()) {
                Consumer<SagaOutcome> callback = inv.getArgument(1);
                callback.accept(outcome);
            }
            return outcome;
        });
    }

    @Nested
    @DisplayName("processMessage")
    class ProcessMessage {

        @Test
        @DisplayName("should hand decoded message to the runtime and delete it")
        @SuppressWarnings("unchecked")
        void shouldHandleAndDelete() {
            runtimeReturns(Result.APPLIED);
            PaymentAuthorized authorized = SagaFixtures.paymentAuthorized(UUID.randomUUID());

            router.processMessage(inboxMessage(5L, authorized));

            verify(runtime).handle(argThat(m -> authorized.messageId().equals(m.messageId())), any(Consumer.class));
            verify(pgmqClient).delete(INBOX, 5L);
            verify(pgmqClient, never()).archive(anyString(), anyLong());
        }

        @Test
        @DisplayName("should archive handled message when archiving is enabled")
        void shouldArchiveWhenConfigured() {
            runtimeReturns(Result.DUPLICATE);
            SagaMessageRouter archiving = router(true);

            archiving.processMessage(inboxMessage(6L, SagaFixtures.paymentAuthorized(UUID.randomUUID())));

            verify(pgmqClient).archive(INBOX, 6L);
            verify(pgmqClient, never()).delete(anyString(), anyLong());
        }

        @Test
        @DisplayName("should archive violations for inspection")
        void shouldArchiveViolation() {
            runtimeReturns(Result.VIOLATION);

            router.processMessage(inboxMessage(7L, SagaFixtures.refundCompleted(UUID.randomUUID())));

            verify(pgmqClient).archive(INBOX, 7L);
            verify(pgmqClient, never()).delete(anyString(), anyLong());
        }

        @Test
        @DisplayName("should leave message on the queue when retries ran out")
        void shouldLeaveUnsettledMessage() {
            runtimeReturns(Result.RETRY_EXHAUSTED);

            router.processMessage(inboxMessage(8L, SagaFixtures.paymentCaptured(UUID.randomUUID())));

            verify(pgmqClient, never()).delete(anyString(), anyLong());
            verify(pgmqClient, never()).archive(anyString(), anyLong());
        }

        @Test
        @DisplayName("should quarantine a message that cannot be decoded")
        @SuppressWarnings("unchecked")
        void shouldQuarantineMalformed() {
            PgmqMessage garbage = new PgmqMessage(9L, 1, Instant.now(), Instant.now(),
                Map.of("type", "PaymentVoided", "orderId", UUID.randomUUID().toString()));

            router.processMessage(garbage);

            verify(incidents).raise(isNull(), isNull(), eq(IncidentKind.MALFORMED_MESSAGE), contains("msg_id=9"));
            verify(pgmqClient).archive(INBOX, 9L);
            verify(runtime, never()).handle(any(InboundMessage.class), any(Consumer.class));
        }

        @Test
        @DisplayName("should keep the message when the runtime fails")
        @SuppressWarnings("unchecked")
        void shouldKeepMessageOnFailure() {
            when(runtime.handle(any(InboundMessage.class), any(Consumer.class)))
                .thenThrow(new IllegalStateException("boom"));

            assertDoesNotThrow(() ->
                router.processMessage(inboxMessage(10L, SagaFixtures.paymentCaptured(UUID.randomUUID()))));

            verify(pgmqClient, never()).delete(anyString(), anyLong());
            verify(pgmqClient, never()).archive(anyString(), anyLong());
            verify(incidents, never()).raise(any(), any(), any(), anyString());
        }

        @Test
        @DisplayName("should archive with an incident once a failing message reaches the read limit")
        @SuppressWarnings("unchecked")
        void shouldSetAsideRepeatedlyFailingMessage() {
            InboundMessage captured = SagaFixtures.paymentCaptured(UUID.randomUUID());
            when(runtime.handle(any(InboundMessage.class), any(Consumer.class)))
                .thenThrow(new ContractViolationException(captured.orderId(), "stream is corrupt"));
            PgmqMessage thirdRead = new PgmqMessage(12L, 3, Instant.now(), Instant.now(), codec.encode(captured));

            router.processMessage(thirdRead);

            verify(incidents).raise(eq(captured.orderId()), eq(captured.messageId()),
                eq(IncidentKind.POISON_MESSAGE), contains("stream is corrupt"));
            verify(pgmqClient).archive(INBOX, 12L);
            verify(pgmqClient, never()).delete(anyString(), anyLong());
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should poll the inbox and process messages until stopped")
        void shouldPollUntilStopped() throws Exception {
            runtimeReturns(Result.APPLIED);
            PgmqMessage message = inboxMessage(11L, SagaFixtures.paymentAuthorized(UUID.randomUUID()));
            when(pgmqClient.read(eq(INBOX), eq(30), anyInt()))
                .thenReturn(List.of(message))
                .thenReturn(List.of());

            router.start();
            assertTrue(router.isRunning());
            verify(pgmqClient, timeout(2000)).delete(INBOX, 11L);

            router.stop(Duration.ofSeconds(1)).get(10, TimeUnit.SECONDS);

            assertFalse(router.isRunning());
            assertEquals(0, router.inFlightCount());
            assertEquals(INBOX, router.getInboxQueue());
        }

        @Test
        @DisplayName("stop on a router that never started completes at once")
        void stopWithoutStart() {
            assertTrue(router.stop(Duration.ofSeconds(1)).isDone());
        }
    }
}

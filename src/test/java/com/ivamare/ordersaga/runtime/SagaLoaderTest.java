package com.ivamare.ordersaga.runtime;

import com.ivamare.ordersaga.decider.Decider;
import com.ivamare.ordersaga.decider.Decision;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.exception.ContractViolationException;
import com.ivamare.ordersaga.message.InboundMessage;
import com.ivamare.ordersaga.store.EventStore;
import com.ivamare.ordersaga.store.RecordedEvent;
import com.ivamare.ordersaga.support.InMemoryEventStore;
import com.ivamare.ordersaga.support.InMemorySnapshotStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static com.ivamare.ordersaga.support.SagaFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SagaLoader")
class SagaLoaderTest {

    private final Decider decider = new Decider();
    private InMemoryEventStore eventStore;
    private InMemorySnapshotStore snapshotStore;
    private SagaLoader loader;
    private UUID orderId;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        snapshotStore = new InMemorySnapshotStore();
        loader = new SagaLoader(eventStore, snapshotStore);
        orderId = UUID.randomUUID();
    }

    private OrderSaga record(OrderSaga state, InboundMessage message) {
        Decision decision = decider.decide(state, message);
        assertEquals(Decision.Kind.APPLIED, decision.kind());
        eventStore.append(orderId, state.version(), decision.events(), message.messageId());
        return decision.state();
    }

    @Test
    @DisplayName("should return the empty saga for an unknown order")
    void shouldReturnEmptySaga() {
        OrderSaga saga = loader.load(orderId);

        assertEquals(OrderStatus.NOT_PLACED, saga.status());
        assertEquals(0L, saga.version());
    }

    @Test
    @DisplayName("should fold the whole stream without a snapshot")
    void shouldFoldWholeStream() {
        OrderSaga state = OrderSaga.empty(orderId);
        state = record(state, checkout(orderId));
        state = record(state, paymentAuthorized(orderId));

        OrderSaga loaded = loader.load(orderId);

        assertEquals(state, loaded);
        assertEquals(OrderStatus.RESERVING_INVENTORY, loaded.status());
    }

    @Test
    @DisplayName("should fold only the events after the snapshot")
    void shouldFoldTailAfterSnapshot() {
        OrderSaga state = OrderSaga.empty(orderId);
        state = record(state, checkout(orderId));
        state = record(state, paymentAuthorized(orderId));
        snapshotStore.save(state);
        state = record(state, reservationConfirmed(orderId));

        OrderSaga loaded = loader.load(orderId);

        assertEquals(state, loaded);
        assertEquals(OrderStatus.CAPTURING_PAYMENT, loaded.status());
    }

    @Test
    @DisplayName("should reject a stream holding another order's event")
    void shouldRejectForeignEvent() {
        UUID otherOrder = UUID.randomUUID();
        OrderSaga other = OrderSaga.empty(otherOrder);
        Decision placed = decider.decide(other, checkout(otherOrder));
        RecordedEvent foreign = new RecordedEvent(otherOrder, 1, placed.events().get(0), UUID.randomUUID(), Instant.now());

        EventStore corrupted = mock(EventStore.class);
        when(corrupted.load(eq(orderId), anyLong())).thenReturn(List.of(foreign));

        SagaLoader corruptedLoader = new SagaLoader(corrupted, snapshotStore);

        assertThrows(ContractViolationException.class, () -> corruptedLoader.load(orderId));
    }
}

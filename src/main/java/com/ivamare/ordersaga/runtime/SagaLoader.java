package com.ivamare.ordersaga.runtime;

import com.ivamare.ordersaga.decider.SagaEvolver;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.exception.ContractViolationException;
import com.ivamare.ordersaga.store.EventStore;
import com.ivamare.ordersaga.store.RecordedEvent;
import com.ivamare.ordersaga.store.SnapshotStore;

import java.util.List;
import java.util.UUID;

/**
 * Rebuilds saga state from the latest snapshot plus the events recorded after it.
 */
public class SagaLoader {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;

    public SagaLoader(EventStore eventStore, SnapshotStore snapshotStore) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
    }

    public OrderSaga load(UUID orderId) {
        OrderSaga state = snapshotStore.load(orderId).orElseGet(() -> OrderSaga.empty(orderId));
        List<RecordedEvent> tail = eventStore.load(orderId, state.version());
        for (RecordedEvent recorded : tail) {
            if (!orderId.equals(recorded.orderId())) {
                throw new ContractViolationException(orderId,
                    "stream contains an event of order " + recorded.orderId());
            }
            state = SagaEvolver.evolve(state, recorded.event(), recorded.version());
        }
        return state;
    }
}

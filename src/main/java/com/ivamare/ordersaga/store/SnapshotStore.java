package com.ivamare.ordersaga.store;

import com.ivamare.ordersaga.domain.OrderSaga;

import java.util.Optional;
import java.util.UUID;

/**
 * Folded saga state cached at a stream version, to shorten loading of long streams.
 */
public interface SnapshotStore {

    Optional<OrderSaga> load(UUID orderId);

    /**
     * Store a snapshot. An existing snapshot at a higher version is kept.
     */
    void save(OrderSaga saga);
}

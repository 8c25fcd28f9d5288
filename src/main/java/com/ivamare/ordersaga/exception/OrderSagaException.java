package com.ivamare.ordersaga.exception;

/**
 * Base exception for all order saga errors.
 */
public class OrderSagaException extends RuntimeException {

    public OrderSagaException(String message) {
        super(message);
    }

    public OrderSagaException(String message, Throwable cause) {
        super(message, cause);
    }
}

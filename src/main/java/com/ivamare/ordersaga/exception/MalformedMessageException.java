package com.ivamare.ordersaga.exception;

/**
 * Raised when an inbox payload cannot be turned into a known message.
 */
public class MalformedMessageException extends OrderSagaException {

    public MalformedMessageException(String message) {
        super(message);
    }

    public MalformedMessageException(String message, Throwable cause) {
        super(message, cause);
    }
}

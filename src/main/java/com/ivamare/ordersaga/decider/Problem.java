package com.ivamare.ordersaga.decider;

/**
 * A single validation failure.
 *
 * @param field Offending field, dotted for nested values (e.g. lineItems[1].quantity)
 * @param message Human readable description
 */
public record Problem(String field, String message) {

    @Override
    public String toString() {
        return field + ": " + message;
    }
}

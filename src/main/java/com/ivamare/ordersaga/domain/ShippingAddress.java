package com.ivamare.ordersaga.domain;

/**
 * Delivery destination of an order.
 *
 * @param street First address line
 * @param street2 Second address line (nullable)
 * @param city City
 * @param state State or province
 * @param postalCode Postal code
 * @param country Country code
 */
public record ShippingAddress(
    String street,
    String street2,
    String city,
    String state,
    String postalCode,
    String country
) {
}

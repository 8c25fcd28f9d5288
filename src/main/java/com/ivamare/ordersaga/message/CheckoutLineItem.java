package com.ivamare.ordersaga.message;

import java.math.BigDecimal;

/**
 * Product line as submitted at checkout.
 */
public record CheckoutLineItem(String sku, int quantity, BigDecimal priceAtPurchase) {
}

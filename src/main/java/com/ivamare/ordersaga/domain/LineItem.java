package com.ivamare.ordersaga.domain;

import java.math.BigDecimal;

/**
 * A purchased product line.
 *
 * @param sku Product SKU
 * @param quantity Number of units
 * @param unitPrice Price per unit at purchase time
 * @param lineTotal quantity * unitPrice
 */
public record LineItem(
    String sku,
    int quantity,
    BigDecimal unitPrice,
    BigDecimal lineTotal
) {
    /**
     * Create a line item, computing the line total.
     */
    public static LineItem of(String sku, int quantity, BigDecimal unitPrice) {
        return new LineItem(sku, quantity, unitPrice, unitPrice.multiply(BigDecimal.valueOf(quantity)));
    }
}

package com.ivamare.ordersaga.decider;

import com.ivamare.ordersaga.message.CheckoutCompleted;
import com.ivamare.ordersaga.message.CheckoutLineItem;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates a completed checkout before an order saga is created from it.
 *
 * <p>All rules are checked; the result lists every problem found.
 */
public class CheckoutValidator {

    public List<Problem> validate(CheckoutCompleted checkout) {
        List<Problem> problems = new ArrayList<>();

        if (checkout.orderId() == null) {
            problems.add(new Problem("orderId", "Order ID is required"));
        }
        if (checkout.checkoutId() == null) {
            problems.add(new Problem("checkoutId", "Checkout ID is required"));
        }
        if (checkout.customerId() == null) {
            problems.add(new Problem("customerId", "Customer ID is required"));
        }

        List<CheckoutLineItem> lineItems = checkout.lineItems();
        if (lineItems == null || lineItems.isEmpty()) {
            problems.add(new Problem("lineItems", "Order must contain at least one item"));
        } else {
            for (int i = 0; i < lineItems.size(); i++) {
                validateLineItem(lineItems.get(i), "lineItems[" + i + "]", problems);
            }
        }

        if (checkout.shippingAddress() == null) {
            problems.add(new Problem("shippingAddress", "Shipping address is required"));
        }
        if (isBlank(checkout.shippingMethod())) {
            problems.add(new Problem("shippingMethod", "Shipping method is required"));
        }
        if (checkout.shippingCost() == null || checkout.shippingCost().signum() < 0) {
            problems.add(new Problem("shippingCost", "Shipping cost cannot be negative"));
        }
        if (isBlank(checkout.paymentMethodToken())) {
            problems.add(new Problem("paymentMethodToken", "Payment method token is required"));
        }
        if (checkout.completedAt() == null) {
            problems.add(new Problem("completedAt", "Completion time is required"));
        }

        return problems;
    }

    private void validateLineItem(CheckoutLineItem item, String path, List<Problem> problems) {
        if (item == null) {
            problems.add(new Problem(path, "Line item is required"));
            return;
        }
        if (isBlank(item.sku())) {
            problems.add(new Problem(path + ".sku", "SKU is required"));
        }
        if (item.quantity() <= 0) {
            problems.add(new Problem(path + ".quantity", "Quantity must be positive"));
        }
        BigDecimal price = item.priceAtPurchase();
        if (price == null || price.signum() <= 0) {
            problems.add(new Problem(path + ".priceAtPurchase", "Price must be positive"));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

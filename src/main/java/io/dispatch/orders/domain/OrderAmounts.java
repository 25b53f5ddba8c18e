package io.dispatch.orders.domain;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

/**
 * Totals derived from the line items. Always computed here, never taken from the caller.
 * {@code total = subtotal - discount} holds by construction.
 */
public record OrderAmounts(BigDecimal subtotal, BigDecimal discount, BigDecimal total) {

    public OrderAmounts {
        Objects.requireNonNull(subtotal);
        Objects.requireNonNull(discount);
        Objects.requireNonNull(total);
    }

    public static OrderAmounts of(List<OrderItem> items) {
        var subtotal = OrderItem.round(items.stream()
            .map(OrderItem::grossTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add));
        var total = OrderItem.round(items.stream()
            .map(OrderItem::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add));
        if (subtotal.compareTo(OrderItem.MAX_AMOUNT) > 0)
            throw BusinessException.validation("order amount is too large");
        return new OrderAmounts(subtotal, subtotal.subtract(total), total);
    }
}

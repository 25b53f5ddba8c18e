package io.dispatch.orders.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * One ordered menu position. Unit price and discount are rounded to two fractional digits on
 * construction, so totals recomputed from stored items match the stored totals.
 *
 * @param menuItemId      menu reference, optional for free-form positions
 * @param discountPercent discount applied to the unit price, between 0 and 100
 */
public record OrderItem(
    Long menuItemId,
    String name,
    BigDecimal unitPrice,
    BigDecimal discountPercent,
    int quantity
) {
    static final int SCALE = 2;
    static final BigDecimal MAX_AMOUNT = new BigDecimal("9999999999.99");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public OrderItem {
        name = name == null ? "" : name;
        Objects.requireNonNull(unitPrice, "unitPrice cannot be null");
        Objects.requireNonNull(discountPercent, "discountPercent cannot be null");
        unitPrice = round(unitPrice);
        discountPercent = round(discountPercent);
        if (unitPrice.signum() < 0)
            throw BusinessException.validation("item price cannot be negative");
        if (unitPrice.compareTo(MAX_AMOUNT) > 0)
            throw BusinessException.validation("item price is too large");
        if (discountPercent.signum() < 0 || discountPercent.compareTo(HUNDRED) > 0)
            throw BusinessException.validation("item discount must be between 0 and 100");
        if (quantity <= 0)
            throw BusinessException.validation("item quantity must be positive");
    }

    public BigDecimal finalPrice() {
        var factor = BigDecimal.ONE.subtract(discountPercent.divide(HUNDRED));
        return round(unitPrice.multiply(factor));
    }

    public BigDecimal lineTotal() {
        return round(finalPrice().multiply(BigDecimal.valueOf(quantity)));
    }

    public BigDecimal grossTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    static BigDecimal round(BigDecimal value) {
        return value.setScale(SCALE, RoundingMode.HALF_UP);
    }
}

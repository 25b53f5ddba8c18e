package io.dispatch.orders.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Caller input for creating or fully replacing an order, before validation. Payment method,
 * order type and status are kept as received so that coercion and rejection happen in one
 * place, {@link #validate(OrderingRules)}.
 */
public record OrderDraft(
    String orderNo,
    String customerName,
    String phone,
    String paymentMethod,
    List<Line> lines,
    String orderType,
    Instant scheduledAt,
    String status,
    DeliveryAddress address,
    String notes,
    Long courierUnitId,
    Long pickupUnitId
) {
    public OrderDraft {
        lines = lines == null ? List.of() : List.copyOf(lines);
        address = address == null ? DeliveryAddress.EMPTY : address;
    }

    public Validated validate(OrderingRules rules) {
        Objects.requireNonNull(rules, "rules cannot be null");
        var contact = new Contact(customerName, phone);
        var payment = PaymentMethod.resolve(paymentMethod, rules.strictPaymentMethods());
        var kind = OrderKind.fromWire(orderType);
        var requestedStatus = status == null || status.isBlank() ? null : OrderStatus.fromWire(status);
        var items = lines.stream().map(Line::toItem).toList();
        return new Validated(blankToNull(orderNo), contact, payment, items, OrderAmounts.of(items),
            kind, scheduledAt, requestedStatus, address, blankToNull(notes), courierUnitId, pickupUnitId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /** A selected item as sent by the client; missing numbers count as zero. */
    public record Line(Long menuItemId, String name, BigDecimal price, BigDecimal discount, Integer quantity) {

        OrderItem toItem() {
            return new OrderItem(menuItemId, name,
                price == null ? BigDecimal.ZERO : price,
                discount == null ? BigDecimal.ZERO : discount,
                quantity == null ? 0 : quantity);
        }
    }

    /**
     * Draft after validation and normalization.
     *
     * @param status requested status, {@code null} when the caller did not send one
     */
    public record Validated(
        String orderNo,
        Contact contact,
        PaymentMethod paymentMethod,
        List<OrderItem> items,
        OrderAmounts amounts,
        OrderKind kind,
        Instant scheduledAt,
        OrderStatus status,
        DeliveryAddress address,
        String notes,
        Long courierUnitId,
        Long pickupUnitId
    ) {}
}

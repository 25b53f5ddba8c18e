package io.dispatch.orders.api.mobile;

import io.dispatch.orders.domain.Order;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Courier view of an order. The door code is kept out of {@code address} and sent separately.
 */
public record MobileOrderResponse(
    UUID id,
    String orderNo,
    int orderSeq,
    LocalDate orderDay,
    String orderType,
    String status,
    Instant createdAt,
    Instant scheduledAt,
    BigDecimal amountTotal,
    String paymentMethod,
    String customer,
    String phone,
    String address,
    String code,
    String notes,
    Long pickupId,
    List<Item> items
) {
    public static MobileOrderResponse from(Order order) {
        return new MobileOrderResponse(
            order.id(), order.orderNo(), order.dailySequence(), order.operationalDay(),
            order.kind().wireValue(), order.status().wireValue(), order.createdAt(), order.scheduledAt(),
            order.amounts().total(), order.paymentMethod().wireValue(),
            order.contact().customerName(), order.contact().phone(),
            order.address().formatted(false), order.address().code(), order.notes(),
            order.assignment().pickupUnitId(),
            order.items().stream().map(i -> new Item(i.name(), i.quantity(), i.lineTotal())).toList());
    }

    public record Item(String name, int quantity, BigDecimal lineTotal) {}
}

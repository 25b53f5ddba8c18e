package io.dispatch.orders.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Flat view of an order as shown in order lists and carried by change notifications.
 */
public record OrderSnapshot(
    UUID id,
    String orderNo,
    int orderSeq,
    LocalDate orderDay,
    String orderType,
    String status,
    Instant createdAt,
    Instant updatedAt,
    Instant scheduledAt,
    BigDecimal amountTotal,
    String paymentMethod,
    String customer,
    String phone,
    String address,
    Long dispatcherUnitId,
    Long pickupId,
    Long courierId
) {
    public static OrderSnapshot from(Order order) {
        return new OrderSnapshot(
            order.id(), order.orderNo(), order.dailySequence(), order.operationalDay(),
            order.kind().wireValue(), order.status().wireValue(),
            order.createdAt(), order.updatedAt(), order.scheduledAt(),
            order.amounts().total(), order.paymentMethod().wireValue(),
            order.contact().customerName(), order.contact().phone(),
            order.address().formatted(true),
            order.assignment().dispatcherUnitId(), order.assignment().pickupUnitId(),
            order.assignment().courierUnitId());
    }
}

package io.dispatch.orders.api.order;

import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderItem;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

public record OrderDetailResponse(
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
    BigDecimal amountSubtotal,
    BigDecimal amountDiscount,
    String paymentMethod,
    String customer,
    String phone,
    String address,
    String addressStreet,
    String addressHouse,
    String addressBuilding,
    String addressApartment,
    String addressFloor,
    String addressCode,
    Long dispatcherUnitId,
    Long pickupId,
    Long courierId,
    String notes,
    List<ItemResponse> items
) {
    public static OrderDetailResponse from(Order order) {
        var address = order.address();
        return new OrderDetailResponse(
            order.id(), order.orderNo(), order.dailySequence(), order.operationalDay(),
            order.kind().wireValue(), order.status().wireValue(),
            order.createdAt(), order.updatedAt(), order.scheduledAt(),
            order.amounts().total(), order.amounts().subtotal(), order.amounts().discount(),
            order.paymentMethod().wireValue(),
            order.contact().customerName(), order.contact().phone(),
            address.formatted(true), address.street(), address.house(), address.building(),
            address.apartment(), address.floor(), address.code(),
            order.assignment().dispatcherUnitId(), order.assignment().pickupUnitId(),
            order.assignment().courierUnitId(), order.notes(),
            order.items().stream().map(ItemResponse::from).toList());
    }

    public record ItemResponse(
        Long id,
        String name,
        BigDecimal price,
        BigDecimal discount,
        int quantity,
        BigDecimal finalPrice,
        BigDecimal lineTotal
    ) {
        static ItemResponse from(OrderItem item) {
            return new ItemResponse(item.menuItemId(), item.name(), item.unitPrice(),
                item.discountPercent(), item.quantity(), item.finalPrice(), item.lineTotal());
        }
    }
}

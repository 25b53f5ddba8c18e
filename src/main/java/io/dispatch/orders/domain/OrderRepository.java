package io.dispatch.orders.domain;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface OrderRepository {
    Order save(Order order);
    Optional<Order> findById(long tenantId, UUID orderId);
    Order update(Order order);
    Order updateStatus(Order order);
    List<Order> findAll(OrderQuery query);
}

package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderQuery;
import io.dispatch.orders.domain.OrderRepository;
import io.dispatch.orders.domain.TenantContext;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

@Service
@Transactional(readOnly = true)
public class FindOrdersUseCase {

    private final OrderRepository orderRepository;

    public FindOrdersUseCase(OrderRepository orderRepository) {
        this.orderRepository = Objects.requireNonNull(orderRepository, "orderRepository cannot be null");
    }

    public List<Order> list(OrderQuery query) {
        return orderRepository.findAll(query);
    }

    public Order get(TenantContext tenant, UUID orderId) {
        return orderRepository.findById(tenant.companyId(), orderId)
            .orElseThrow(() -> BusinessException.orderNotFound(orderId));
    }

    /** Courier view of one order. Orders handed to another courier are hidden. */
    public Order getForCourier(TenantContext tenant, UUID orderId) {
        var order = get(tenant, orderId);
        if (order.assignment().isAssignedToAnotherCourier(tenant.unitId())) {
            throw new BusinessException(ErrorCode.ORDER_ACCESS_DENIED);
        }
        return order;
    }
}

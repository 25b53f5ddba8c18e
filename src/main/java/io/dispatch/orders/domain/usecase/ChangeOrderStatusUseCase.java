package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderChangeEvent;
import io.dispatch.orders.domain.OrderRepository;
import io.dispatch.orders.domain.OrderStatus;
import io.dispatch.orders.domain.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

@Service
public class ChangeOrderStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(ChangeOrderStatusUseCase.class);

    private final OrderRepository orderRepository;
    private final OrderCommitter committer;
    private final Clock clock;

    public ChangeOrderStatusUseCase(OrderRepository orderRepository,
                                    OrderCommitter committer,
                                    Clock clock) {
        this.orderRepository = Objects.requireNonNull(orderRepository, "orderRepository cannot be null");
        this.committer = Objects.requireNonNull(committer, "committer cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public Order execute(final Input input) {
        Objects.requireNonNull(input.tenant(), "tenant cannot be null");
        var target = OrderStatus.fromWire(input.status());
        long tenantId = input.tenant().companyId();

        var changed = committer.commit(() -> {
            var current = orderRepository.findById(tenantId, input.orderId())
                .orElseThrow(() -> BusinessException.orderNotFound(input.orderId()));
            return orderRepository.updateStatus(current.transitionTo(target, clock.instant()));
        });

        log.info("Order status changed id={} tenant={} status={}",
            changed.id(), tenantId, changed.status().wireValue());
        committer.notifyCommitted(OrderChangeEvent.updated(changed, clock.instant()));
        return changed;
    }

    public record Input(TenantContext tenant, UUID orderId, String status) {}
}

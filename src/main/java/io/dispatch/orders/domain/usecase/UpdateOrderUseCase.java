package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderChangeEvent;
import io.dispatch.orders.domain.OrderDraft;
import io.dispatch.orders.domain.OrderRepository;
import io.dispatch.orders.domain.OrderingRules;
import io.dispatch.orders.domain.TenantContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Objects;
import java.util.UUID;

@Service
public class UpdateOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(UpdateOrderUseCase.class);

    private final OrderRepository orderRepository;
    private final OrderCommitter committer;
    private final OrderingRules rules;
    private final Clock clock;

    public UpdateOrderUseCase(OrderRepository orderRepository,
                              OrderCommitter committer,
                              OrderingRules rules,
                              Clock clock) {
        this.orderRepository = Objects.requireNonNull(orderRepository, "orderRepository cannot be null");
        this.committer = Objects.requireNonNull(committer, "committer cannot be null");
        this.rules = Objects.requireNonNull(rules, "rules cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    public Order execute(final Input input) {
        Objects.requireNonNull(input.tenant(), "tenant cannot be null");
        var draft = input.draft().validate(rules);
        long tenantId = input.tenant().companyId();

        var updated = committer.commit(() -> {
            var current = orderRepository.findById(tenantId, input.orderId())
                .orElseThrow(() -> BusinessException.orderNotFound(input.orderId()));
            return orderRepository.update(current.revise(draft, clock.instant()));
        });

        log.info("Order updated id={} tenant={} status={}",
            updated.id(), tenantId, updated.status().wireValue());
        committer.notifyCommitted(OrderChangeEvent.updated(updated, clock.instant()));
        return updated;
    }

    public record Input(TenantContext tenant, UUID orderId, OrderDraft draft) {}
}

package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.DailySequenceAllocator;
import io.dispatch.orders.domain.OperationalDay;
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

@Service
public class CreateOrderUseCase {

    private static final Logger log = LoggerFactory.getLogger(CreateOrderUseCase.class);

    private final OrderRepository orderRepository;
    private final DailySequenceAllocator sequenceAllocator;
    private final OrderCommitter committer;
    private final ContentionRetryPolicy retryPolicy;
    private final OrderingRules rules;
    private final Clock clock;

    public CreateOrderUseCase(OrderRepository orderRepository,
                              DailySequenceAllocator sequenceAllocator,
                              OrderCommitter committer,
                              ContentionRetryPolicy retryPolicy,
                              OrderingRules rules,
                              Clock clock) {
        this.orderRepository = Objects.requireNonNull(orderRepository, "orderRepository cannot be null");
        this.sequenceAllocator = Objects.requireNonNull(sequenceAllocator, "sequenceAllocator cannot be null");
        this.committer = Objects.requireNonNull(committer, "committer cannot be null");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy cannot be null");
        this.rules = Objects.requireNonNull(rules, "rules cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Validates the draft, then allocates the daily number and inserts the order in one
     * transaction, retrying the whole transaction on sequence contention. {@code order_created}
     * is published after commit.
     */
    public Order execute(final Input input) {
        Objects.requireNonNull(input.tenant(), "tenant cannot be null");
        var draft = input.draft().validate(rules);
        var now = clock.instant();
        var day = OperationalDay.derive(draft.kind(), draft.scheduledAt(), now, rules.zone());
        long tenantId = input.tenant().companyId();

        var created = retryPolicy.execute(() -> committer.commit(() -> {
            int sequence = sequenceAllocator.allocate(tenantId, day);
            return orderRepository.save(Order.create(input.tenant(), draft, day, sequence, now));
        }));

        log.info("Order created id={} tenant={} day={} seq={}",
            created.id(), tenantId, created.operationalDay(), created.dailySequence());
        committer.notifyCommitted(OrderChangeEvent.created(created, clock.instant()));
        return created;
    }

    public record Input(TenantContext tenant, OrderDraft draft) {}
}

package io.dispatch.orders.infrastructure.persistence;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderQuery;
import io.dispatch.orders.domain.OrderRepository;
import io.dispatch.orders.domain.SequenceConflictException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public class OrderRepositoryImpl implements OrderRepository {

    static final String SEQUENCE_CONSTRAINT = "uq_orders_tenant_day_seq";

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("createdAt"), Sort.Order.desc("id"));

    private final OrderJpaRepository jpaRepository;

    public OrderRepositoryImpl(OrderJpaRepository jpaRepository) {
        this.jpaRepository = jpaRepository;
    }

    /** Inserts and flushes so that a duplicate daily number fails inside the caller's transaction. */
    @Override
    public Order save(Order order) {
        try {
            return jpaRepository.saveAndFlush(OrderEntity.of(order)).toDomain();
        } catch (DataIntegrityViolationException e) {
            if (violates(e, SEQUENCE_CONSTRAINT)) {
                throw new SequenceConflictException(order.tenantId(), order.operationalDay(), e);
            }
            throw e;
        }
    }

    @Override
    public Optional<Order> findById(long tenantId, UUID orderId) {
        return jpaRepository.findByIdAndTenantId(orderId, tenantId).map(OrderEntity::toDomain);
    }

    @Override
    public Order update(Order order) {
        var entity = load(order);
        entity.apply(order);
        return jpaRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    public Order updateStatus(Order order) {
        var entity = load(order);
        entity.applyStatus(order);
        return jpaRepository.saveAndFlush(entity).toDomain();
    }

    @Override
    public List<Order> findAll(OrderQuery query) {
        var page = PageRequest.of(0, query.limit(), NEWEST_FIRST);
        return jpaRepository.findAll(OrderSpecifications.matching(query), page)
            .map(OrderEntity::toDomain)
            .getContent();
    }

    private OrderEntity load(Order order) {
        return jpaRepository.findByIdAndTenantId(order.id(), order.tenantId())
            .orElseThrow(() -> BusinessException.orderNotFound(order.id()));
    }

    private static boolean violates(DataIntegrityViolationException e, String constraint) {
        var message = e.getMostSpecificCause().getMessage();
        return message != null && message.contains(constraint);
    }
}

package io.dispatch.orders.infrastructure.persistence;

import io.dispatch.orders.domain.OrderQuery;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;

final class OrderSpecifications {

    private OrderSpecifications() {}

    static Specification<OrderEntity> matching(OrderQuery query) {
        return (root, criteria, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            predicates.add(cb.equal(root.get("tenantId"), query.tenantId()));
            if (query.kind() != null) {
                predicates.add(cb.equal(root.get("orderType"), query.kind()));
            }
            if (!query.statuses().isEmpty()) {
                predicates.add(root.get("status").in(query.statuses()));
            }
            if (query.courierUnitId() != null) {
                predicates.add(cb.equal(root.get("courierUnitId"), query.courierUnitId()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}

package io.dispatch.orders.infrastructure.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;

import java.util.Optional;
import java.util.UUID;

public interface OrderJpaRepository extends JpaRepository<OrderEntity, UUID>,
                                            JpaSpecificationExecutor<OrderEntity> {

    Optional<OrderEntity> findByIdAndTenantId(UUID id, long tenantId);
}

package io.dispatch.orders.domain;

import java.time.LocalDate;

public interface DailySequenceAllocator {

    /**
     * Issues the next number of the {@code (tenantId, operationalDay)} partition. Must run inside
     * the caller's transaction so that a rollback also discards the allocation.
     *
     * @throws SequenceConflictException when a concurrent allocation prevented a clean increment
     */
    int allocate(long tenantId, LocalDate operationalDay);
}

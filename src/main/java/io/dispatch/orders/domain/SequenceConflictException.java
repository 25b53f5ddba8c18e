package io.dispatch.orders.domain;

import java.time.LocalDate;

/**
 * Raised when a daily sequence number could not be secured for a partition because a concurrent
 * transaction held or took it. Transient: the whole create attempt is rolled back and retried.
 */
public class SequenceConflictException extends RuntimeException {

    private final long tenantId;
    private final LocalDate operationalDay;

    public SequenceConflictException(long tenantId, LocalDate operationalDay, Throwable cause) {
        super("Sequence conflict for tenant " + tenantId + " on " + operationalDay, cause);
        this.tenantId = tenantId;
        this.operationalDay = operationalDay;
    }

    public long tenantId() {
        return tenantId;
    }

    public LocalDate operationalDay() {
        return operationalDay;
    }
}

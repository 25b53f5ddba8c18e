package io.dispatch.orders.infrastructure.persistence;

import io.dispatch.orders.domain.DailySequenceAllocator;
import io.dispatch.orders.domain.SequenceConflictException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.SQLException;
import java.time.LocalDate;
import java.util.Set;

/**
 * Issues daily order numbers from the {@code daily_counters} table.
 *
 * <p>One atomic {@code INSERT ... ON CONFLICT DO UPDATE ... RETURNING} creates the partition row
 * on first use and increments it afterwards. Concurrent callers on the same partition serialize
 * on the row lock until the holder's transaction ends, so a rolled back order also gives its
 * number back.
 */
@Repository
public class PostgresDailySequenceAllocator implements DailySequenceAllocator {

    // deadlock_detected, lock_not_available, serialization_failure
    private static final Set<String> LOCK_FAILURE_STATES = Set.of("40P01", "55P03", "40001");

    @PersistenceContext private EntityManager entityManager;

    @Override
    @Transactional(propagation = Propagation.MANDATORY)
    public int allocate(long tenantId, LocalDate operationalDay) {
        try {
            var result = entityManager
                .createNativeQuery(
                    "INSERT INTO daily_counters (tenant_id, operational_day, last_sequence)"
                        + " VALUES (:tenantId, :day, 1)"
                        + " ON CONFLICT (tenant_id, operational_day)"
                        + " DO UPDATE SET last_sequence = daily_counters.last_sequence + 1"
                        + " RETURNING last_sequence")
                .setParameter("tenantId", tenantId)
                .setParameter("day", operationalDay)
                .getSingleResult();
            return ((Number) result).intValue();
        } catch (PersistenceException e) {
            if (isLockFailure(e)) {
                throw new SequenceConflictException(tenantId, operationalDay, e);
            }
            throw e;
        }
    }

    private static boolean isLockFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && LOCK_FAILURE_STATES.contains(sql.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}

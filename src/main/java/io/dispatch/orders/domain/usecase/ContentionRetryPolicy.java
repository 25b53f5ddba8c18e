package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import io.dispatch.orders.domain.SequenceConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Bounded retry for attempts that lost a race on a daily sequence partition. Every attempt must
 * be a complete transaction so that a retry starts from a clean state.
 */
public final class ContentionRetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(ContentionRetryPolicy.class);

    private final int maxAttempts;
    private final Duration minBackoff;
    private final Duration maxBackoff;

    public ContentionRetryPolicy(int maxAttempts, Duration minBackoff, Duration maxBackoff) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        this.minBackoff = Objects.requireNonNull(minBackoff, "minBackoff cannot be null");
        this.maxBackoff = Objects.requireNonNull(maxBackoff, "maxBackoff cannot be null");
        if (minBackoff.isNegative() || maxBackoff.compareTo(minBackoff) < 0)
            throw new IllegalArgumentException("backoff range is invalid");
        this.maxAttempts = maxAttempts;
    }

    public <T> T execute(Supplier<T> attempt) {
        SequenceConflictException lastConflict = null;
        for (int attemptNo = 1; attemptNo <= maxAttempts; attemptNo++) {
            try {
                return attempt.get();
            } catch (SequenceConflictException e) {
                lastConflict = e;
                log.warn("Sequence conflict for tenant={} day={}, attempt {}/{}",
                    e.tenantId(), e.operationalDay(), attemptNo, maxAttempts);
                if (attemptNo < maxAttempts) {
                    backoff();
                }
            }
        }
        throw new BusinessException(ErrorCode.CONTENTION_EXCEEDED,
            "Could not allocate an order number after " + maxAttempts + " attempts", lastConflict);
    }

    private void backoff() {
        if (Thread.currentThread().isInterrupted()) {
            throw new BusinessException(ErrorCode.REQUEST_CANCELLED);
        }
        long min = minBackoff.toMillis();
        long max = maxBackoff.toMillis();
        long delay = min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1);
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusinessException(ErrorCode.REQUEST_CANCELLED,
                ErrorCode.REQUEST_CANCELLED.defaultMessage(), e);
        }
    }
}

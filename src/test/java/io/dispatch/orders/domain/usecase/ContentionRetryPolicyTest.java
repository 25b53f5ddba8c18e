package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.ErrorCode;
import io.dispatch.orders.domain.SequenceConflictException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentionRetryPolicyTest {

    private static final LocalDate DAY = LocalDate.parse("2024-09-20");

    private final ContentionRetryPolicy policy = new ContentionRetryPolicy(5, Duration.ZERO, Duration.ofMillis(1));

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void shouldReturnFirstSuccessfulAttempt() {
        var attempts = new AtomicInteger();

        var result = policy.execute(() -> {
            if (attempts.incrementAndGet() < 3) throw new SequenceConflictException(1L, DAY, null);
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(attempts).hasValue(3);
    }

    @Test
    void shouldGiveUpAfterMaxAttempts() {
        var attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new SequenceConflictException(1L, DAY, null);
        }))
            .isInstanceOfSatisfying(BusinessException.class,
                e -> assertThat(e.errorCode()).isEqualTo(ErrorCode.CONTENTION_EXCEEDED))
            .hasCauseInstanceOf(SequenceConflictException.class);

        assertThat(attempts).hasValue(5);
    }

    @Test
    void shouldNotRetryOtherFailures() {
        var attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw BusinessException.validation("bad");
        })).isInstanceOf(BusinessException.class).hasMessage("bad");

        assertThat(attempts).hasValue(1);
    }

    @Test
    void shouldStopRetryingWhenInterrupted() {
        var attempts = new AtomicInteger();
        Thread.currentThread().interrupt();

        assertThatThrownBy(() -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new SequenceConflictException(1L, DAY, null);
        }))
            .isInstanceOfSatisfying(BusinessException.class,
                e -> assertThat(e.errorCode()).isEqualTo(ErrorCode.REQUEST_CANCELLED));

        assertThat(attempts).hasValue(1);
        assertThat(Thread.currentThread().isInterrupted()).isTrue();
    }

    @Test
    void shouldRejectInvalidConfiguration() {
        assertThatThrownBy(() -> new ContentionRetryPolicy(0, Duration.ZERO, Duration.ZERO))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ContentionRetryPolicy(3, Duration.ofMillis(50), Duration.ofMillis(10)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}

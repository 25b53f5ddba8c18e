package io.dispatch.orders.domain.usecase;

import io.dispatch.orders.AbstractIntegrationTest;
import io.dispatch.orders.MutableClock;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderFixtures;
import io.dispatch.orders.domain.OrderStatus;
import io.dispatch.orders.domain.TenantContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@Import(DailySequenceScenarioIntegrationTest.ClockConfiguration.class)
class DailySequenceScenarioIntegrationTest extends AbstractIntegrationTest {

    private static final LocalDate SEPT_20 = LocalDate.parse("2024-09-20");
    private static final LocalDate SEPT_21 = LocalDate.parse("2024-09-21");

    @Autowired
    private MutableClock clock;

    @Autowired
    private CreateOrderUseCase createOrderUseCase;

    @Autowired
    private UpdateOrderUseCase updateOrderUseCase;

    @Autowired
    private ChangeOrderStatusUseCase changeOrderStatusUseCase;

    @Test
    @DisplayName("scheduled orders reserve numbers on their scheduled day, shared with orders created that day")
    void shouldNumberOrdersPerTenantAndOperationalDay() {
        var t1 = TenantContext.of(newTenantId());
        var t2 = TenantContext.of(newTenantId());
        clock.set(Instant.parse("2024-09-20T09:00:00Z"));

        var first = active(t1);
        var second = active(t1);
        var third = active(t1);
        var otherTenant = active(t2);

        assertThat(first.operationalDay()).isEqualTo(SEPT_20);
        assertThat(new int[]{first.dailySequence(), second.dailySequence(), third.dailySequence()})
            .containsExactly(1, 2, 3);
        assertThat(otherTenant.dailySequence()).isEqualTo(1);

        var reservation = scheduled(t1, "2024-09-21T10:00:00Z");
        var secondReservation = scheduled(t1, "2024-09-21T12:30:00Z");

        assertThat(reservation.operationalDay()).isEqualTo(SEPT_21);
        assertThat(reservation.dailySequence()).isEqualTo(1);
        assertThat(secondReservation.operationalDay()).isEqualTo(SEPT_21);
        assertThat(secondReservation.dailySequence()).isEqualTo(2);

        clock.set(Instant.parse("2024-09-21T08:00:00Z"));
        var nextDay = active(t1);

        assertThat(nextDay.operationalDay()).isEqualTo(SEPT_21);
        assertThat(nextDay.dailySequence()).isEqualTo(3);
    }

    @Test
    @DisplayName("updates and status changes never renumber an order")
    void shouldKeepNumberingThroughUpdates() {
        var tenant = TenantContext.of(newTenantId());
        clock.set(Instant.parse("2024-09-20T09:00:00Z"));
        var reservation = scheduled(tenant, "2024-09-21T10:00:00Z");

        clock.set(Instant.parse("2024-09-22T09:00:00Z"));
        var moved = updateOrderUseCase.execute(new UpdateOrderUseCase.Input(tenant, reservation.id(),
            OrderFixtures.scheduledDraft(Instant.parse("2024-09-25T10:00:00Z"))));
        var ready = changeOrderStatusUseCase.execute(
            new ChangeOrderStatusUseCase.Input(tenant, reservation.id(), "ready"));

        assertThat(moved.operationalDay()).isEqualTo(SEPT_21);
        assertThat(moved.dailySequence()).isEqualTo(1);
        assertThat(moved.scheduledAt()).isEqualTo(Instant.parse("2024-09-25T10:00:00Z"));
        assertThat(ready.status()).isEqualTo(OrderStatus.READY);
        assertThat(ready.operationalDay()).isEqualTo(SEPT_21);
        assertThat(ready.dailySequence()).isEqualTo(1);
    }

    private Order active(TenantContext tenant) {
        return createOrderUseCase.execute(new CreateOrderUseCase.Input(tenant, OrderFixtures.activeDraft()));
    }

    private Order scheduled(TenantContext tenant, String at) {
        return createOrderUseCase.execute(
            new CreateOrderUseCase.Input(tenant, OrderFixtures.scheduledDraft(Instant.parse(at))));
    }

    @TestConfiguration
    static class ClockConfiguration {
        @Bean
        @Primary
        MutableClock mutableClock() {
            return new MutableClock(Instant.parse("2024-09-20T09:00:00Z"));
        }
    }
}

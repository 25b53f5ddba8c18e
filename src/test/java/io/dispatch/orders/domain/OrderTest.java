package io.dispatch.orders.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static io.dispatch.orders.domain.OrderFixtures.NOW;
import static io.dispatch.orders.domain.OrderFixtures.TENANT;
import static io.dispatch.orders.domain.OrderFixtures.TODAY;
import static io.dispatch.orders.domain.OrderFixtures.activeDraft;
import static io.dispatch.orders.domain.OrderFixtures.borscht;
import static io.dispatch.orders.domain.OrderFixtures.draft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrderTest {

    @Test
    void shouldCreateOrderWithNewStatusByDefault() {
        var order = Order.create(TENANT, activeDraft().validate(OrderingRules.DEFAULT), TODAY, 3, NOW);

        assertThat(order.id()).isNotNull();
        assertThat(order.status()).isEqualTo(OrderStatus.NEW);
        assertThat(order.tenantId()).isEqualTo(7L);
        assertThat(order.operationalDay()).isEqualTo(TODAY);
        assertThat(order.dailySequence()).isEqualTo(3);
        assertThat(order.createdAt()).isEqualTo(NOW);
        assertThat(order.updatedAt()).isEqualTo(NOW);
    }

    @Test
    void shouldRecordCreatingUnitAsDispatcher() {
        var order = Order.create(TENANT, activeDraft().validate(OrderingRules.DEFAULT), TODAY, 1, NOW);

        assertThat(order.assignment().dispatcherUnitId()).isEqualTo(70L);
    }

    @Test
    void shouldGenerateOrderNoFromLastEightDigitsOfCreationMillis() {
        var order = Order.create(TENANT, activeDraft().validate(OrderingRules.DEFAULT), TODAY, 1, NOW);

        var millis = Long.toString(NOW.toEpochMilli());
        assertThat(order.orderNo()).isEqualTo("CO-" + millis.substring(millis.length() - 8));
    }

    @Test
    void shouldKeepCallerSuppliedOrderNo() {
        var input = new OrderDraft("A-17", "Иван", "+7999", "card", List.of(borscht(1)), null, null, null,
            null, null, null, null);

        var order = Order.create(TENANT, input.validate(OrderingRules.DEFAULT), TODAY, 1, NOW);

        assertThat(order.orderNo()).isEqualTo("A-17");
    }

    @Test
    void shouldAcceptRequestedInitialStatus() {
        var input = draft("active", null, "ready", List.of(borscht(1)));

        var order = Order.create(TENANT, input.validate(OrderingRules.DEFAULT), TODAY, 1, NOW);

        assertThat(order.status()).isEqualTo(OrderStatus.READY);
    }

    @Test
    void shouldRejectCancelledAsInitialStatus() {
        var input = draft("active", null, "cancelled", List.of(borscht(1))).validate(OrderingRules.DEFAULT);

        assertThatThrownBy(() -> Order.create(TENANT, input, TODAY, 1, NOW))
            .isInstanceOfSatisfying(BusinessException.class,
                e -> assertThat(e.errorCode()).isEqualTo(ErrorCode.INVALID_STATUS));
    }

    @Test
    void shouldRejectNonPositiveSequence() {
        var input = activeDraft().validate(OrderingRules.DEFAULT);

        assertThatThrownBy(() -> Order.create(TENANT, input, TODAY, 0, NOW))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldKeepNumberingWhenRevised() {
        var order = OrderFixtures.newOrder();
        var later = NOW.plusSeconds(3600);
        var revision = draft("preorder", Instant.parse("2024-09-25T12:00:00Z"), null,
            List.of(borscht(4))).validate(OrderingRules.DEFAULT);

        var revised = order.revise(revision, later);

        assertThat(revised.id()).isEqualTo(order.id());
        assertThat(revised.operationalDay()).isEqualTo(order.operationalDay());
        assertThat(revised.dailySequence()).isEqualTo(order.dailySequence());
        assertThat(revised.orderNo()).isEqualTo(order.orderNo());
        assertThat(revised.kind()).isEqualTo(OrderKind.SCHEDULED);
        assertThat(revised.amounts().total()).isEqualByComparingTo(new BigDecimal("1000.00"));
        assertThat(revised.createdAt()).isEqualTo(order.createdAt());
        assertThat(revised.updatedAt()).isEqualTo(later);
    }

    @Test
    void shouldKeepStatusWhenRevisionOmitsIt() {
        var order = OrderFixtures.newOrder(OrderStatus.READY);

        var revised = order.revise(activeDraft().validate(OrderingRules.DEFAULT), NOW);

        assertThat(revised.status()).isEqualTo(OrderStatus.READY);
    }

    @Test
    void shouldRejectRevisionWithIllegalTransition() {
        var order = OrderFixtures.newOrder().transitionTo(OrderStatus.CANCELLED, NOW);
        var revision = draft("active", null, "new", List.of(borscht(1))).validate(OrderingRules.DEFAULT);

        assertThatThrownBy(() -> order.revise(revision, NOW))
            .isInstanceOf(BusinessException.class)
            .hasMessageContaining("cancelled");
    }

    @Test
    void shouldKeepDispatcherWhenReassigned() {
        var order = OrderFixtures.newOrder();
        var revision = new OrderDraft(null, "Иван", "+7999", "cash", List.of(borscht(1)), null, null, null,
            null, null, 11L, 12L).validate(OrderingRules.DEFAULT);

        var revised = order.revise(revision, NOW);

        assertThat(revised.assignment()).isEqualTo(new Assignment(11L, 12L, 70L));
    }

    @Test
    void shouldTouchOnlyStatusAndUpdatedAtOnTransition() {
        var order = OrderFixtures.newOrder();
        var later = NOW.plusSeconds(60);

        var ready = order.transitionTo(OrderStatus.READY, later);

        assertThat(ready.status()).isEqualTo(OrderStatus.READY);
        assertThat(ready.updatedAt()).isEqualTo(later);
        assertThat(ready).usingRecursiveComparison()
            .ignoringFields("status", "updatedAt")
            .isEqualTo(order);
    }

    @Test
    void shouldRefreshUpdatedAtOnSameStatusTransition() {
        var order = OrderFixtures.newOrder();
        var later = NOW.plusSeconds(60);

        var same = order.transitionTo(OrderStatus.NEW, later);

        assertThat(same.status()).isEqualTo(OrderStatus.NEW);
        assertThat(same.updatedAt()).isEqualTo(later);
    }

    @Test
    void shouldNotLeaveCancelled() {
        var cancelled = OrderFixtures.newOrder().transitionTo(OrderStatus.CANCELLED, NOW);

        assertThatThrownBy(() -> cancelled.transitionTo(OrderStatus.READY, NOW))
            .isInstanceOf(BusinessException.class);
    }

    @Test
    void shouldExposeFlatSnapshot() {
        var order = OrderFixtures.newOrder();

        var snapshot = order.snapshot();

        assertThat(snapshot.id()).isEqualTo(order.id());
        assertThat(snapshot.orderSeq()).isEqualTo(1);
        assertThat(snapshot.orderDay()).isEqualTo(LocalDate.parse("2024-09-20"));
        assertThat(snapshot.orderType()).isEqualTo("active");
        assertThat(snapshot.status()).isEqualTo("new");
        assertThat(snapshot.paymentMethod()).isEqualTo("cash");
        assertThat(snapshot.amountTotal()).isEqualByComparingTo("500.00");
        assertThat(snapshot.address()).isEqualTo("Ленина, д.10, кв.5, эт.2, код 1234");
        assertThat(snapshot.dispatcherUnitId()).isEqualTo(70L);
    }
}

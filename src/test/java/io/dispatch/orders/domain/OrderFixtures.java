package io.dispatch.orders.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public final class OrderFixtures {

    public static final Instant NOW = Instant.parse("2024-09-20T09:00:00Z");
    public static final LocalDate TODAY = LocalDate.parse("2024-09-20");
    public static final TenantContext TENANT = new TenantContext(7L, 70L);

    private OrderFixtures() {}

    public static OrderDraft.Line borscht(int quantity) {
        return new OrderDraft.Line(1L, "Борщ", new BigDecimal("250.00"), BigDecimal.ZERO, quantity);
    }

    public static OrderDraft activeDraft() {
        return draft("active", null, null, List.of(borscht(2)));
    }

    public static OrderDraft scheduledDraft(Instant scheduledAt) {
        return draft("preorder", scheduledAt, null, List.of(borscht(1)));
    }

    public static OrderDraft draft(String orderType, Instant scheduledAt, String status, List<OrderDraft.Line> lines) {
        return new OrderDraft(null, "Иван", "+79990001122", "cash", lines, orderType, scheduledAt, status,
            new DeliveryAddress("Ленина", "10", null, "5", "2", "1234"), "call on arrival", null, null);
    }

    public static Order newOrder() {
        return Order.create(TENANT, activeDraft().validate(OrderingRules.DEFAULT), TODAY, 1, NOW);
    }

    public static Order newOrder(OrderStatus status) {
        var draft = draft("active", null, status.wireValue(), List.of(borscht(1)));
        return Order.create(TENANT, draft.validate(OrderingRules.DEFAULT), TODAY, 1, NOW);
    }
}

package io.dispatch.orders.domain;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Tenant-scoped order listing, newest first.
 *
 * @param kind          restrict to one order kind, {@code null} for any
 * @param statuses      allowed statuses, empty for any
 * @param courierUnitId restrict to one courier, {@code null} for any
 */
public record OrderQuery(long tenantId, OrderKind kind, Set<OrderStatus> statuses,
                         Long courierUnitId, int limit) {

    static final int PANEL_LIMIT = 500;
    static final int COURIER_LIMIT = 100;

    public OrderQuery {
        statuses = statuses == null || statuses.isEmpty() ? Set.of() : Set.copyOf(statuses);
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive");
    }

    public static OrderQuery forPanel(long tenantId, String tab) {
        return switch (normalize(tab)) {
            case "active" -> new OrderQuery(tenantId, OrderKind.ACTIVE,
                EnumSet.of(OrderStatus.NEW, OrderStatus.READY, OrderStatus.ENROUTE, OrderStatus.PAUSED),
                null, PANEL_LIMIT);
            case "preorders" -> new OrderQuery(tenantId, OrderKind.SCHEDULED, Set.of(), null, PANEL_LIMIT);
            default -> new OrderQuery(tenantId, null, Set.of(), null, PANEL_LIMIT);
        };
    }

    public static OrderQuery forCourier(TenantContext tenant, String tab) {
        Objects.requireNonNull(tenant, "tenant cannot be null");
        var statuses = "active".equals(normalize(tab))
            ? EnumSet.of(OrderStatus.NEW, OrderStatus.READY, OrderStatus.ENROUTE)
            : Set.<OrderStatus>of();
        return new OrderQuery(tenant.companyId(), null, statuses, tenant.unitId(), COURIER_LIMIT);
    }

    private static String normalize(String tab) {
        return tab == null || tab.isBlank() ? "active" : tab.trim().toLowerCase(Locale.ROOT);
    }
}

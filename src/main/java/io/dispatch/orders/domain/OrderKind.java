package io.dispatch.orders.domain;

import java.util.Locale;

public enum OrderKind {
    ACTIVE("active"),
    SCHEDULED("preorder");

    private final String wireValue;

    OrderKind(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /** Blank means an active order; {@code scheduled} is accepted as a synonym of {@code preorder}. */
    public static OrderKind fromWire(String value) {
        if (value == null || value.isBlank()) return ACTIVE;
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "active" -> ACTIVE;
            case "preorder", "scheduled" -> SCHEDULED;
            default -> throw BusinessException.validation("Unknown order type: " + value);
        };
    }
}

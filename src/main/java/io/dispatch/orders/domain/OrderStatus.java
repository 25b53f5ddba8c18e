package io.dispatch.orders.domain;

import java.util.Arrays;
import java.util.Locale;

/**
 * Lifecycle of an order: {@code new -> ready -> enroute}, with {@code paused} and
 * {@code cancelled} reachable from every non-terminal state. A paused order resumes into any of
 * the working states. Nothing leaves {@code cancelled}.
 */
public enum OrderStatus {
    NEW("new"),
    READY("ready"),
    ENROUTE("enroute"),
    PAUSED("paused"),
    CANCELLED("cancelled");

    private final String wireValue;

    OrderStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public boolean isTerminal() {
        return this == CANCELLED;
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null || isTerminal()) return false;
        if (target == this) return true;
        return switch (target) {
            case PAUSED, CANCELLED -> true;
            case READY -> this == NEW || this == PAUSED;
            case ENROUTE -> this == READY || this == PAUSED;
            case NEW -> this == PAUSED;
        };
    }

    public OrderStatus transitionTo(OrderStatus target) {
        if (!canTransitionTo(target)) {
            throw new BusinessException(ErrorCode.INVALID_STATUS,
                "Cannot change order status from " + wireValue + " to "
                    + (target == null ? "null" : target.wireValue));
        }
        return target;
    }

    public static OrderStatus fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw BusinessException.validation("status is required");
        }
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(s -> s.wireValue.equals(normalized))
            .findFirst()
            .orElseThrow(() -> new BusinessException(ErrorCode.INVALID_STATUS,
                "Unknown order status: " + value));
    }
}

package io.dispatch.orders.domain;

import java.util.Locale;
import java.util.Optional;
import java.util.Set;

public enum PaymentMethod {
    CASH("cash", Set.of("cash", "наличные", "нал")),
    CARD("card", Set.of("card", "карта", "банковская карта")),
    WIRE("wire", Set.of("wire", "перечислением", "безнал", "безналичный"));

    private final String wireValue;
    private final Set<String> aliases;

    PaymentMethod(String wireValue, Set<String> aliases) {
        this.wireValue = wireValue;
        this.aliases = aliases;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<PaymentMethod> recognize(String value) {
        if (value == null) return Optional.empty();
        var normalized = value.trim().toLowerCase(Locale.ROOT);
        for (var method : values()) {
            if (method.aliases.contains(normalized)) return Optional.of(method);
        }
        return Optional.empty();
    }

    /**
     * Maps caller input onto the supported methods. Blank input is a validation failure.
     * Unrecognized input falls back to {@link #CASH} unless {@code strict} is set.
     */
    public static PaymentMethod resolve(String value, boolean strict) {
        if (value == null || value.isBlank()) {
            throw BusinessException.validation("payment method is required");
        }
        return recognize(value).orElseGet(() -> {
            if (strict) {
                throw new BusinessException(ErrorCode.INVALID_PAYMENT_METHOD,
                    "Unrecognized payment method: " + value);
            }
            return CASH;
        });
    }
}

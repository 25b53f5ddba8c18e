package io.dispatch.orders.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Notification that an order was durably created or changed.
 *
 * @param companyId tenant the event belongs to; {@code null} marks an untagged event that goes to
 *                  every subscriber
 */
public record OrderChangeEvent(
    Type type,
    UUID eventId,
    Instant occurredAt,
    Long companyId,
    OrderSnapshot order
) {
    public OrderChangeEvent {
        Objects.requireNonNull(type);
        Objects.requireNonNull(eventId);
        Objects.requireNonNull(occurredAt);
        Objects.requireNonNull(order);
    }

    public static OrderChangeEvent created(Order order, Instant occurredAt) {
        return new OrderChangeEvent(Type.ORDER_CREATED, UUID.randomUUID(), occurredAt,
            order.tenantId(), order.snapshot());
    }

    public static OrderChangeEvent updated(Order order, Instant occurredAt) {
        return new OrderChangeEvent(Type.ORDER_UPDATED, UUID.randomUUID(), occurredAt,
            order.tenantId(), order.snapshot());
    }

    public enum Type {
        ORDER_CREATED("order_created"),
        ORDER_UPDATED("order_updated");

        private final String wireValue;

        Type(String wireValue) {
            this.wireValue = wireValue;
        }

        public String wireValue() {
            return wireValue;
        }
    }
}

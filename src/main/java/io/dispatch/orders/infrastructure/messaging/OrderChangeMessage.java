package io.dispatch.orders.infrastructure.messaging;

import io.dispatch.orders.domain.OrderChangeEvent;
import io.dispatch.orders.domain.OrderSnapshot;

import java.util.UUID;

/**
 * JSON shape of a delivered change: {@code {type, eventId, ts, companyId, order}}, {@code ts} in
 * epoch milliseconds.
 */
public record OrderChangeMessage(
    String type,
    UUID eventId,
    long ts,
    Long companyId,
    OrderSnapshot order
) {
    public static OrderChangeMessage from(OrderChangeEvent event) {
        return new OrderChangeMessage(event.type().wireValue(), event.eventId(),
            event.occurredAt().toEpochMilli(), event.companyId(), event.order());
    }
}

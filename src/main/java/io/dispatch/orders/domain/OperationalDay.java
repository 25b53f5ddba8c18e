package io.dispatch.orders.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Derives the calendar day whose sequence partition an order belongs to.
 *
 * <p>A scheduled order with a scheduled time reserves a number on its scheduled day, so that
 * orders created on that day continue after the reservations. Everything else is numbered on
 * the day it is created.
 */
public final class OperationalDay {

    private OperationalDay() {}

    public static LocalDate derive(OrderKind kind, Instant scheduledAt, Instant now, ZoneId zone) {
        Objects.requireNonNull(now, "now cannot be null");
        Objects.requireNonNull(zone, "zone cannot be null");
        if (kind == OrderKind.SCHEDULED && scheduledAt != null) {
            return LocalDate.ofInstant(scheduledAt, zone);
        }
        return LocalDate.ofInstant(now, zone);
    }
}

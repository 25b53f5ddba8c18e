package io.dispatch.orders.domain;

import java.time.ZoneId;
import java.util.Objects;

/**
 * Tenant-independent policy knobs of the order core.
 *
 * @param zone                 zone whose calendar dates define operational days
 * @param strictPaymentMethods reject unrecognized payment methods instead of coercing to cash
 */
public record OrderingRules(ZoneId zone, boolean strictPaymentMethods) {

    public static final OrderingRules DEFAULT = new OrderingRules(ZoneId.of("UTC"), false);

    public OrderingRules {
        Objects.requireNonNull(zone, "zone cannot be null");
    }
}

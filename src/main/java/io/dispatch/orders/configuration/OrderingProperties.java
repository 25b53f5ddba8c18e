package io.dispatch.orders.configuration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Settings under {@code ordering.*}.
 *
 * @param zone zone whose calendar dates are the operational days
 */
@ConfigurationProperties(prefix = "ordering")
public record OrderingProperties(
    @DefaultValue("UTC") ZoneId zone,
    @DefaultValue Sequence sequence,
    @DefaultValue Payment payment,
    @DefaultValue Notifier notifier
) {

    /** Retry of a create that lost a race on its daily number. */
    public record Sequence(
        @DefaultValue("5") int maxAttempts,
        @DefaultValue("10ms") Duration minBackoff,
        @DefaultValue("50ms") Duration maxBackoff
    ) {}

    /** @param strict reject unrecognized payment methods instead of recording them as cash */
    public record Payment(@DefaultValue("false") boolean strict) {}

    public record Notifier(
        @DefaultValue("2") int corePoolSize,
        @DefaultValue("4") int maxPoolSize,
        @DefaultValue("1000") int queueCapacity,
        @DefaultValue Kafka kafka
    ) {}

    public record Kafka(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("order.changes") String topic
    ) {}
}

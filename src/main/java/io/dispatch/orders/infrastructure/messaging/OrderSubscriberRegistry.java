package io.dispatch.orders.infrastructure.messaging;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Live subscribers of order change messages. Safe for concurrent registration and lookup.
 */
@Component
public class OrderSubscriberRegistry {

    private final ConcurrentMap<String, OrderChangeSubscriber> subscribers = new ConcurrentHashMap<>();

    public Registration register(OrderChangeSubscriber subscriber) {
        Objects.requireNonNull(subscriber, "subscriber cannot be null");
        if (subscribers.putIfAbsent(subscriber.id(), subscriber) != null) {
            throw new IllegalStateException("Subscriber already registered: " + subscriber.id());
        }
        // by identity: a value-equal replacement under the same id must survive a stale close
        return () -> subscribers.computeIfPresent(subscriber.id(),
            (id, current) -> current == subscriber ? null : current);
    }

    /**
     * Subscribers that should receive an event of {@code companyId}: those registered for that
     * tenant plus the tenant-agnostic ones. An untagged event ({@code null}) goes to everyone.
     */
    public List<OrderChangeSubscriber> subscribersFor(Long companyId) {
        return subscribers.values().stream()
            .filter(s -> companyId == null || s.tenantId() == null || companyId.equals(s.tenantId()))
            .toList();
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }
}

package io.dispatch.orders.infrastructure.messaging;

import io.dispatch.orders.domain.OrderChangeEvent;

/**
 * A receiver of order change messages, such as an open dispatcher screen or a message relay.
 */
public interface OrderChangeSubscriber {

    /** Unique key of this subscriber within the registry. */
    String id();

    /** Tenant whose events this subscriber receives, {@code null} to receive every tenant's. */
    Long tenantId();

    /**
     * @param payload the event serialized as JSON, shared by every subscriber of one publish
     */
    void deliver(OrderChangeEvent event, String payload);
}

package io.dispatch.orders.infrastructure.messaging;

import io.dispatch.orders.domain.OrderChangeEvent;
import io.dispatch.orders.domain.OrderChangeNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans every committed change out to the registered subscribers of its tenant. Each delivery
 * runs on the notification executor; a full executor drops the delivery rather than block the
 * publishing request.
 */
@Service
public class OrderChangeBroadcaster implements OrderChangeNotifier {

    private static final Logger log = LoggerFactory.getLogger(OrderChangeBroadcaster.class);

    private final OrderSubscriberRegistry registry;
    private final ObjectMapper objectMapper;
    private final Executor executor;

    public OrderChangeBroadcaster(OrderSubscriberRegistry registry,
                                  ObjectMapper objectMapper,
                                  @Qualifier("notificationExecutor") Executor executor) {
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.executor = executor;
    }

    @Override
    public void publish(OrderChangeEvent event) {
        var targets = registry.subscribersFor(event.companyId());
        if (targets.isEmpty()) {
            return;
        }
        var payload = serialize(event);
        for (var subscriber : targets) {
            try {
                executor.execute(() -> deliver(subscriber, event, payload));
            } catch (RejectedExecutionException e) {
                log.warn("Notification executor saturated, dropped {} for subscriber={} orderId={}",
                    event.type().wireValue(), subscriber.id(), event.order().id());
            }
        }
    }

    private void deliver(OrderChangeSubscriber subscriber, OrderChangeEvent event, String payload) {
        try {
            subscriber.deliver(event, payload);
        } catch (RuntimeException e) {
            log.warn("Subscriber {} failed to receive eventId={}: {}",
                subscriber.id(), event.eventId(), e.getMessage());
        }
    }

    private String serialize(OrderChangeEvent event) {
        try {
            return objectMapper.writeValueAsString(OrderChangeMessage.from(event));
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize order change " + event.eventId(), e);
        }
    }
}

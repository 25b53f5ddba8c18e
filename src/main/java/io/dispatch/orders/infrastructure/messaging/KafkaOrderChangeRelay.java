package io.dispatch.orders.infrastructure.messaging;

import io.dispatch.orders.domain.OrderChangeEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

/**
 * Tenant-agnostic subscriber that forwards every change message to Kafka, keyed by company id.
 */
@Component
@ConditionalOnProperty(prefix = "ordering.notifier.kafka", name = "enabled", havingValue = "true", matchIfMissing = true)
public class KafkaOrderChangeRelay implements OrderChangeSubscriber {

    private static final Logger log = LoggerFactory.getLogger(KafkaOrderChangeRelay.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OrderSubscriberRegistry registry;
    private final String topic;
    private OrderSubscriberRegistry.Registration registration;

    public KafkaOrderChangeRelay(KafkaTemplate<String, String> kafkaTemplate,
                                 OrderSubscriberRegistry registry,
                                 @Value("${ordering.notifier.kafka.topic:order.changes}") String topic) {
        this.kafkaTemplate = kafkaTemplate;
        this.registry = registry;
        this.topic = topic;
    }

    @PostConstruct
    void subscribe() {
        registration = registry.register(this);
    }

    @PreDestroy
    void unsubscribe() {
        if (registration != null) {
            registration.close();
        }
    }

    @Override
    public String id() {
        return "kafka:" + topic;
    }

    @Override
    public Long tenantId() {
        return null;
    }

    @Override
    public void deliver(OrderChangeEvent event, String payload) {
        var key = event.companyId() == null ? null : event.companyId().toString();
        kafkaTemplate.send(topic, key, payload)
            .exceptionally(ex -> {
                log.error("Order change eventId={} orderId={} was not delivered to topic {}. Cause: {}",
                    event.eventId(), event.order().id(), topic, ex.getMessage());
                return null;
            });
    }
}

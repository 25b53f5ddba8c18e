package io.dispatch.orders.domain;

/**
 * Fans committed order changes out to subscribers. Must return without waiting for delivery.
 */
public interface OrderChangeNotifier {
    void publish(OrderChangeEvent event);
}

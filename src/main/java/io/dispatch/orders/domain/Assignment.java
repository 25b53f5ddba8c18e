package io.dispatch.orders.domain;

/**
 * Company units attached to an order. The dispatcher is the unit that created the order.
 */
public record Assignment(Long courierUnitId, Long pickupUnitId, Long dispatcherUnitId) {

    public Assignment reassign(Long courierUnitId, Long pickupUnitId) {
        return new Assignment(courierUnitId, pickupUnitId, dispatcherUnitId);
    }

    public boolean isAssignedToAnotherCourier(Long courierUnitId) {
        return courierUnitId != null
            && this.courierUnitId != null
            && !this.courierUnitId.equals(courierUnitId);
    }
}

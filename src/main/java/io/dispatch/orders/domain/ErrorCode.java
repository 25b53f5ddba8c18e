package io.dispatch.orders.domain;

public enum ErrorCode {
    VALIDATION_FAILED("Request validation failed"),
    INVALID_STATUS("Unknown or illegal order status"),
    INVALID_PAYMENT_METHOD("Unrecognized payment method"),
    TENANT_UNRESOLVED("Could not determine the company of the caller"),
    ORDER_NOT_FOUND("Order not found"),
    ORDER_ACCESS_DENIED("Order is assigned to another courier"),
    CONTENTION_EXCEEDED("Too many concurrent orders, retry the request"),
    CONSTRAINT_VIOLATION("Order conflicts with existing data"),
    REQUEST_CANCELLED("Request was cancelled before the order was stored"),
    PERSISTENCE_FAILURE("Order could not be stored"),
    INTERNAL_ERROR("Internal server error");

    private final String defaultMessage;

    ErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}

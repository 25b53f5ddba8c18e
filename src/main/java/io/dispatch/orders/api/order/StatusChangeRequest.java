package io.dispatch.orders.api.order;

public record StatusChangeRequest(String status) {}

package io.dispatch.orders.domain;

public record Contact(String customerName, String phone) {

    public Contact {
        if (customerName == null || customerName.isBlank())
            throw BusinessException.validation("customer name is required");
        if (phone == null || phone.isBlank())
            throw BusinessException.validation("customer phone is required");
    }
}

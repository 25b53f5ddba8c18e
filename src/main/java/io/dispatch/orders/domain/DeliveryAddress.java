package io.dispatch.orders.domain;

import java.util.ArrayList;
import java.util.List;

public record DeliveryAddress(
    String street,
    String house,
    String building,
    String apartment,
    String floor,
    String code
) {
    public static final DeliveryAddress EMPTY = new DeliveryAddress(null, null, null, null, null, null);

    public DeliveryAddress {
        street = blankToNull(street);
        house = blankToNull(house);
        building = blankToNull(building);
        apartment = blankToNull(apartment);
        floor = blankToNull(floor);
        code = blankToNull(code);
    }

    /** Single-line form shown on dispatcher and courier screens. */
    public String formatted(boolean withCode) {
        List<String> parts = new ArrayList<>();
        if (street != null) parts.add(street);
        if (house != null) parts.add("д." + house);
        if (building != null) parts.add("к." + building);
        if (apartment != null) parts.add("кв." + apartment);
        if (floor != null) parts.add("эт." + floor);
        if (withCode && code != null) parts.add("код " + code);
        return String.join(", ", parts);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}

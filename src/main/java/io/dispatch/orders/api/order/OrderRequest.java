package io.dispatch.orders.api.order;

import com.fasterxml.jackson.annotation.JsonAlias;
import io.dispatch.orders.domain.BusinessException;
import io.dispatch.orders.domain.DeliveryAddress;
import io.dispatch.orders.domain.OrderDraft;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Body of the dispatcher's create and update calls.
 */
public record OrderRequest(
    String orderNo,
    String customer,
    String phone,
    String payment,
    List<SelectedItem> selectedItems,
    String orderType,
    String scheduledAt,
    String status,
    String street,
    String house,
    String building,
    @JsonAlias("apart") String apartment,
    String floor,
    String code,
    String notes,
    Long courierId,
    Long pickupId
) {

    /**
     * @param zone zone of a {@code scheduledAt} sent without an offset
     */
    public OrderDraft toDraft(ZoneId zone) {
        var lines = selectedItems == null ? List.<OrderDraft.Line>of() : selectedItems.stream()
            .map(i -> new OrderDraft.Line(i.id(), i.name(), i.price(), i.discount(), i.quantity()))
            .toList();
        return new OrderDraft(orderNo, customer, phone, payment, lines, orderType,
            parseInstant(scheduledAt, zone), status,
            new DeliveryAddress(street, house, building, apartment, floor, code),
            notes, courierId, pickupId);
    }

    /**
     * Accepts {@code 2024-09-21T10:00:00Z}, an explicit offset, or a local date-time such as
     * {@code 2024-09-21T10:00} from a datetime-local input, read in {@code zone}.
     */
    static Instant parseInstant(String value, ZoneId zone) {
        if (value == null || value.isBlank()) return null;
        var text = value.trim();
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(text).atZone(zone).toInstant();
            } catch (DateTimeParseException ignored) {
                throw BusinessException.validation("scheduledAt is not a valid timestamp: " + value);
            }
        }
    }

    public record SelectedItem(Long id, String name, BigDecimal price, BigDecimal discount, Integer quantity) {}
}

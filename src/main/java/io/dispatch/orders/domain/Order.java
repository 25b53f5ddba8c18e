package io.dispatch.orders.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A customer order of one tenant. {@code operationalDay} and {@code dailySequence} are
 * assigned once at creation and carried unchanged through every revision.
 */
public record Order(
    UUID id,
    long tenantId,
    String orderNo,
    OrderKind kind,
    LocalDate operationalDay,
    int dailySequence,
    OrderStatus status,
    Instant scheduledAt,
    PaymentMethod paymentMethod,
    Contact contact,
    DeliveryAddress address,
    Assignment assignment,
    String notes,
    List<OrderItem> items,
    OrderAmounts amounts,
    Instant createdAt,
    Instant updatedAt
) {
    public Order {
        Objects.requireNonNull(id);
        Objects.requireNonNull(orderNo);
        Objects.requireNonNull(kind);
        Objects.requireNonNull(operationalDay);
        Objects.requireNonNull(status);
        Objects.requireNonNull(paymentMethod);
        Objects.requireNonNull(contact);
        Objects.requireNonNull(address);
        Objects.requireNonNull(assignment);
        Objects.requireNonNull(items);
        Objects.requireNonNull(amounts);
        Objects.requireNonNull(createdAt);
        Objects.requireNonNull(updatedAt);
        if (dailySequence <= 0) throw new IllegalArgumentException("dailySequence must be positive");
        items = List.copyOf(items);
    }

    public static Order create(TenantContext tenant, OrderDraft.Validated draft,
                               LocalDate operationalDay, int dailySequence, Instant now) {
        Objects.requireNonNull(tenant, "tenant cannot be null");
        Objects.requireNonNull(draft, "draft cannot be null");
        var status = draft.status() == null ? OrderStatus.NEW : draft.status();
        if (status.isTerminal()) {
            throw new BusinessException(ErrorCode.INVALID_STATUS,
                "An order cannot be created as " + status.wireValue());
        }
        var orderNo = draft.orderNo() != null ? draft.orderNo() : generateOrderNo(now);
        var assignment = new Assignment(draft.courierUnitId(), draft.pickupUnitId(), tenant.unitId());
        return new Order(UUID.randomUUID(), tenant.companyId(), orderNo, draft.kind(),
            operationalDay, dailySequence, status, draft.scheduledAt(), draft.paymentMethod(),
            draft.contact(), draft.address(), assignment, draft.notes(), draft.items(),
            draft.amounts(), now, now);
    }

    /** Full replacement of the mutable fields. Numbering stays as assigned at creation. */
    public Order revise(OrderDraft.Validated draft, Instant now) {
        var nextStatus = draft.status() == null ? status : status.transitionTo(draft.status());
        return new Order(id, tenantId, orderNo, draft.kind(), operationalDay, dailySequence,
            nextStatus, draft.scheduledAt(), draft.paymentMethod(), draft.contact(), draft.address(),
            assignment.reassign(draft.courierUnitId(), draft.pickupUnitId()), draft.notes(),
            draft.items(), draft.amounts(), createdAt, now);
    }

    public Order transitionTo(OrderStatus target, Instant now) {
        return withStatus(status.transitionTo(target), now);
    }

    public OrderSnapshot snapshot() {
        return OrderSnapshot.from(this);
    }

    private Order withStatus(OrderStatus newStatus, Instant now) {
        return new Order(id, tenantId, orderNo, kind, operationalDay, dailySequence, newStatus,
            scheduledAt, paymentMethod, contact, address, assignment, notes, items, amounts,
            createdAt, now);
    }

    static String generateOrderNo(Instant now) {
        var millis = Long.toString(now.toEpochMilli());
        return "CO-" + millis.substring(Math.max(0, millis.length() - 8));
    }
}

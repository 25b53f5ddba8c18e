package io.dispatch.orders.infrastructure.persistence;

import io.dispatch.orders.domain.Assignment;
import io.dispatch.orders.domain.Contact;
import io.dispatch.orders.domain.DeliveryAddress;
import io.dispatch.orders.domain.Order;
import io.dispatch.orders.domain.OrderAmounts;
import io.dispatch.orders.domain.OrderItem;
import io.dispatch.orders.domain.OrderKind;
import io.dispatch.orders.domain.OrderStatus;
import io.dispatch.orders.domain.PaymentMethod;
import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EntityListeners;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;

import org.springframework.data.annotation.CreatedDate;
import org.springframework.data.annotation.LastModifiedDate;
import org.springframework.data.domain.Persistable;
import org.springframework.data.jpa.domain.support.AuditingEntityListener;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "orders")
@EntityListeners(AuditingEntityListener.class)
public class OrderEntity implements Persistable<UUID> {

    @Id
    private UUID id;

    @Column(name = "tenant_id", nullable = false, updatable = false)
    private long tenantId;

    @Column(name = "order_no", nullable = false, updatable = false, length = 64)
    private String orderNo;

    @Column(name = "order_type", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderKind orderType;

    @Column(name = "operational_day", nullable = false, updatable = false)
    private LocalDate operationalDay;

    @Column(name = "daily_sequence", nullable = false, updatable = false)
    private int dailySequence;

    @Column(name = "status", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private OrderStatus status;

    @Column(name = "scheduled_at")
    private Instant scheduledAt;

    @Column(name = "payment_method", nullable = false, length = 20)
    @Enumerated(EnumType.STRING)
    private PaymentMethod paymentMethod;

    @Column(name = "customer_name", nullable = false)
    private String customerName;

    @Column(name = "phone", nullable = false, length = 64)
    private String phone;

    @Column(name = "address_street")
    private String addressStreet;

    @Column(name = "address_house", length = 64)
    private String addressHouse;

    @Column(name = "address_building", length = 64)
    private String addressBuilding;

    @Column(name = "address_apartment", length = 64)
    private String addressApartment;

    @Column(name = "address_floor", length = 64)
    private String addressFloor;

    @Column(name = "address_code", length = 64)
    private String addressCode;

    @Column(name = "courier_unit_id")
    private Long courierUnitId;

    @Column(name = "pickup_unit_id")
    private Long pickupUnitId;

    @Column(name = "dispatcher_unit_id", updatable = false)
    private Long dispatcherUnitId;

    @Column(name = "notes")
    private String notes;

    @Column(name = "amount_subtotal", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountSubtotal;

    @Column(name = "amount_discount", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountDiscount;

    @Column(name = "amount_total", nullable = false, precision = 12, scale = 2)
    private BigDecimal amountTotal;

    @OneToMany(mappedBy = "order", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.EAGER)
    @OrderBy("lineNo ASC")
    private List<OrderItemEntity> items = new ArrayList<>();

    @CreatedDate
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @LastModifiedDate
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    private transient boolean isNew = true;

    protected OrderEntity() {}

    public static OrderEntity of(final Order order) {
        var entity = new OrderEntity();
        entity.id = order.id();
        entity.tenantId = order.tenantId();
        entity.orderNo = order.orderNo();
        entity.operationalDay = order.operationalDay();
        entity.dailySequence = order.dailySequence();
        entity.dispatcherUnitId = order.assignment().dispatcherUnitId();
        entity.createdAt = order.createdAt();
        entity.apply(order);
        return entity;
    }

    /** Copies every mutable field of {@code order}. Numbering and tenant are never touched. */
    void apply(final Order order) {
        this.orderType = order.kind();
        this.status = order.status();
        this.scheduledAt = order.scheduledAt();
        this.paymentMethod = order.paymentMethod();
        this.customerName = order.contact().customerName();
        this.phone = order.contact().phone();
        applyAddress(order.address());
        this.courierUnitId = order.assignment().courierUnitId();
        this.pickupUnitId = order.assignment().pickupUnitId();
        this.notes = order.notes();
        this.amountSubtotal = order.amounts().subtotal();
        this.amountDiscount = order.amounts().discount();
        this.amountTotal = order.amounts().total();
        this.updatedAt = order.updatedAt();

        items.clear();
        var lines = order.items();
        for (int i = 0; i < lines.size(); i++) {
            items.add(OrderItemEntity.of(this, i, lines.get(i)));
        }
    }

    void applyStatus(final Order order) {
        this.status = order.status();
        this.updatedAt = order.updatedAt();
    }

    private void applyAddress(DeliveryAddress address) {
        this.addressStreet = address.street();
        this.addressHouse = address.house();
        this.addressBuilding = address.building();
        this.addressApartment = address.apartment();
        this.addressFloor = address.floor();
        this.addressCode = address.code();
    }

    public Order toDomain() {
        var domainItems = items.stream()
            .map(OrderItemEntity::toDomain)
            .toList();

        return new Order(id, tenantId, orderNo, orderType, operationalDay, dailySequence, status,
            scheduledAt, paymentMethod, new Contact(customerName, phone),
            new DeliveryAddress(addressStreet, addressHouse, addressBuilding, addressApartment,
                addressFloor, addressCode),
            new Assignment(courierUnitId, pickupUnitId, dispatcherUnitId), notes, domainItems,
            new OrderAmounts(amountSubtotal, amountDiscount, amountTotal), createdAt, updatedAt);
    }

    @Override
    public UUID getId() { return id; }

    @Override
    public boolean isNew() { return isNew; }

    @PostLoad
    @PostPersist
    void markNotNew() { this.isNew = false; }

    public long getTenantId() { return tenantId; }
    public LocalDate getOperationalDay() { return operationalDay; }
    public int getDailySequence() { return dailySequence; }
    public OrderStatus getStatus() { return status; }
    public List<OrderItemEntity> getItems() { return items; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}

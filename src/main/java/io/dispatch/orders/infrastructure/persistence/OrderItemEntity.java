package io.dispatch.orders.infrastructure.persistence;

import io.dispatch.orders.domain.OrderItem;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import java.math.BigDecimal;
import java.util.UUID;

@Entity
@Table(name = "order_items")
public class OrderItemEntity {

    @Id
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "order_id", nullable = false)
    private OrderEntity order;

    @Column(name = "line_no", nullable = false)
    private int lineNo;

    @Column(name = "menu_item_id")
    private Long menuItemId;

    @Column(name = "name", nullable = false)
    private String name;

    @Column(name = "unit_price", nullable = false, precision = 12, scale = 2)
    private BigDecimal unitPrice;

    @Column(name = "discount_percent", nullable = false, precision = 5, scale = 2)
    private BigDecimal discountPercent;

    @Column(name = "quantity", nullable = false)
    private int quantity;

    protected OrderItemEntity() {}

    static OrderItemEntity of(OrderEntity order, int lineNo, OrderItem item) {
        var entity = new OrderItemEntity();
        entity.id = UUID.randomUUID();
        entity.order = order;
        entity.lineNo = lineNo;
        entity.menuItemId = item.menuItemId();
        entity.name = item.name();
        entity.unitPrice = item.unitPrice();
        entity.discountPercent = item.discountPercent();
        entity.quantity = item.quantity();
        return entity;
    }

    OrderItem toDomain() {
        return new OrderItem(menuItemId, name, unitPrice, discountPercent, quantity);
    }

    public UUID getId() { return id; }
    public int getLineNo() { return lineNo; }
    public String getName() { return name; }
}

package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * One line of a purchase order. Lines merged from several products carry every
 * underlying product material id.
 */
@Entity
@Table(name = "purchase_order_items")
@Data
public class PurchaseOrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String orderId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "purchase_order_item_materials", joinColumns = @JoinColumn(name = "item_id"))
    @Column(name = "product_material_id")
    @OrderColumn(name = "item_index")
    private List<String> productMaterialIds = new ArrayList<>();

    private String productId;
    private String productName;
    private String projectId;

    @Column(nullable = false)
    private String materialName;

    private String unit;

    @Column(precision = 19, scale = 4, nullable = false)
    private BigDecimal quantity;

    @Column(precision = 19, scale = 4)
    private BigDecimal expectedPrice;

    @Column(precision = 19, scale = 4)
    private BigDecimal actualPrice;

    @Column(precision = 19, scale = 4)
    private BigDecimal receivedQuantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderItemStatus status;

    private LocalDateTime receivedAt;

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = OrderItemStatus.PENDING;
    }
}

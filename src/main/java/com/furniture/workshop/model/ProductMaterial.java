package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A material line consumed by one product. This is the unit that gets ordered
 * from suppliers and received into the workshop.
 */
@Entity
@Table(name = "product_materials")
@Data
public class ProductMaterial {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String productId;

    private String materialId; // catalogue reference, optional

    @Column(nullable = false)
    private String materialName;

    private String category;

    @Column(precision = 19, scale = 4, nullable = false)
    private BigDecimal quantity;

    private String unit;

    @Column(precision = 19, scale = 4, nullable = false)
    private BigDecimal unitPrice;

    @Column(precision = 19, scale = 4, nullable = false)
    private BigDecimal totalPrice;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private MaterialStatus status;

    private String supplier;

    private String orderId;

    @Column(precision = 19, scale = 4)
    private BigDecimal orderedQuantity;

    private boolean essential;

    private LocalDateTime receivedAt;

    @Transient
    private List<GlassItem> glassItems = new ArrayList<>();

    @Transient
    private List<AluDoorItem> aluDoorItems = new ArrayList<>();

    /** Keeps totalPrice equal to quantity times unit price. */
    public void recomputeTotal() {
        BigDecimal q = quantity != null ? quantity : BigDecimal.ZERO;
        BigDecimal p = unitPrice != null ? unitPrice : BigDecimal.ZERO;
        totalPrice = q.multiply(p).setScale(4, RoundingMode.HALF_UP);
    }

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = MaterialStatus.NOT_ORDERED;
        if (totalPrice == null)
            recomputeTotal();
    }
}

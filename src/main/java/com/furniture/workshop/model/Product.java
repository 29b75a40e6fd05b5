package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "products")
@Data
public class Product {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String projectId;

    @Column(nullable = false)
    private String name;

    // Dimensions in millimetres
    private Integer height;
    private Integer width;
    private Integer depth;

    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProductStatus status;

    @Column(precision = 19, scale = 4)
    private BigDecimal materialCost;

    @Column(length = 2000)
    private String notes;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Transient
    private List<ProductMaterial> materials = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = ProductStatus.WAITING;
        if (materialCost == null)
            materialCost = BigDecimal.ZERO;
        if (quantity == null)
            quantity = 1;
    }
}

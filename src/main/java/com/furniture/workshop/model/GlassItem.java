package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;

@Entity
@Table(name = "glass_items")
@Data
public class GlassItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String productMaterialId;

    private int qty;

    // Millimetres
    private int width;
    private int height;

    @Column(precision = 19, scale = 4)
    private BigDecimal areaM2;

    private boolean edgeProcessing;

    private String note;
}

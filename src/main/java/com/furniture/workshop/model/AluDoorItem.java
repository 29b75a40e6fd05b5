package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;

@Entity
@Table(name = "alu_door_items")
@Data
public class AluDoorItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String productMaterialId;

    private int qty;
    private int width;
    private int height;

    private String frameType;
    private String glassType;
    private String frameColor;
    private String hingeColor;
    private String hingeType;
    private String hingeSide;
    private boolean integratedHandle;

    @Column(precision = 19, scale = 4)
    private BigDecimal areaM2;

    @Column(precision = 19, scale = 4)
    private BigDecimal unitPrice;

    @Column(precision = 19, scale = 4)
    private BigDecimal totalPrice;

    private String note;
}

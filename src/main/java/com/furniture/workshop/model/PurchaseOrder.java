package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "purchase_orders")
@Data
public class PurchaseOrder {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String orderNumber;

    private String supplierId;
    private String supplierName;

    @Column(nullable = false)
    private LocalDate orderDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OrderStatus status;

    private LocalDate expectedDelivery;

    @Column(precision = 19, scale = 4)
    private BigDecimal totalAmount;

    @Column(length = 2000)
    private String notes;

    private LocalDateTime sentAt;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Transient
    private List<PurchaseOrderItem> items = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (orderDate == null)
            orderDate = LocalDate.now();
        if (status == null)
            status = OrderStatus.DRAFT;
        if (totalAmount == null)
            totalAmount = BigDecimal.ZERO;
    }
}

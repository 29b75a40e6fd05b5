package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "work_order_items")
@Data
public class WorkOrderItem {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String workOrderId;

    @Column(nullable = false)
    private String productId;

    private String productName;
    private String projectId;
    private String projectName;

    private Integer quantity;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkOrderItemStatus status;

    @Convert(converter = ProcessAssignmentsConverter.class)
    @Column(length = 4000)
    private List<ProcessAssignment> processes = new ArrayList<>();

    // Furthest production step finished for this item
    @Enumerated(EnumType.STRING)
    private ProductionStep lastCompletedStep;

    @Column(precision = 19, scale = 4)
    private BigDecimal productValue;

    @Column(precision = 19, scale = 4)
    private BigDecimal materialCost;

    @Column(precision = 19, scale = 4)
    private BigDecimal plannedLaborCost;

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = WorkOrderItemStatus.WAITING;
    }
}

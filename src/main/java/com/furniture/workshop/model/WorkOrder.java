package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "work_orders")
@Data
public class WorkOrder {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String workOrderNumber;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private WorkOrderStatus status;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "work_order_steps", joinColumns = @JoinColumn(name = "work_order_id"))
    @Column(name = "step")
    @Enumerated(EnumType.STRING)
    @OrderColumn(name = "step_index")
    private List<ProductionStep> productionSteps = new ArrayList<>();

    private LocalDate dueDate;
    private LocalDate plannedStartDate;
    private LocalDate plannedEndDate;

    private LocalDateTime scheduledAt;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Column(length = 2000)
    private String notes;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Transient
    private List<WorkOrderItem> items = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = WorkOrderStatus.WAITING;
    }
}

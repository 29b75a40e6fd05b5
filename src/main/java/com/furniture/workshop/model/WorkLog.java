package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

/** One worker's day on one work order item. */
@Entity
@Table(name = "work_logs")
@Data
public class WorkLog {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String workerId;

    private String workerName;

    @Column(nullable = false)
    private String workOrderId;

    @Column(nullable = false)
    private String workOrderItemId;

    private String productId;

    @Enumerated(EnumType.STRING)
    private ProductionStep processName;

    @Column(nullable = false)
    private LocalDate workDate;

    @Column(precision = 19, scale = 4, nullable = false)
    private BigDecimal dailyRate;

    private String notes;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}

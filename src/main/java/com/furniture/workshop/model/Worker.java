package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;

@Entity
@Table(name = "workers")
@Data
public class Worker {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String name;

    private String role;
    private String phone;

    @Column(precision = 19, scale = 4)
    private BigDecimal dailyRate;

    @Enumerated(EnumType.STRING)
    private WorkerStatus status;

    @PrePersist
    protected void onCreate() {
        if (status == null)
            status = WorkerStatus.ACTIVE;
    }
}

package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDateTime;

@Entity
@Table(name = "audit_logs")
@Data
public class AuditLog {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String tenantId;

    private String username;
    private String action; // e.g. "ORDER_SENT", "WORK_ORDER_STARTED"

    @Column(length = 1000)
    private String details; // e.g. "Order: N-20240101-123, Items: 4"

    private LocalDateTime timestamp;

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}

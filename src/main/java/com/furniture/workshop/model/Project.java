package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "projects")
@Data
public class Project {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String clientName;

    private String clientPhone;
    private String clientEmail;
    private String address;

    @Column(length = 2000)
    private String notes;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProjectStatus status;

    private String productionMode; // "in-house" or "outsourced"

    private LocalDate deadline;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    // Attached by the graph assembler, never persisted
    @Transient
    private List<Product> products = new ArrayList<>();

    @Transient
    private List<Offer> offers = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = ProjectStatus.DRAFT;
    }
}

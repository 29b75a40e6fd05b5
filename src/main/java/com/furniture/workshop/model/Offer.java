package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "offers")
@Data
public class Offer {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String projectId;

    @Column(nullable = false)
    private String offerNumber;

    private LocalDate validUntil;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private OfferStatus status;

    @Column(precision = 19, scale = 4)
    private BigDecimal transportCost;

    private boolean onsiteAssembly;

    @Column(precision = 19, scale = 4)
    private BigDecimal onsiteDiscount;

    @Column(precision = 19, scale = 4)
    private BigDecimal subtotal;

    @Column(precision = 19, scale = 4)
    private BigDecimal total;

    @Column(length = 2000)
    private String notes;

    private LocalDateTime acceptedAt;

    @Column(updatable = false)
    private LocalDateTime createdAt;

    @Transient
    private List<OfferProduct> products = new ArrayList<>();

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (status == null)
            status = OfferStatus.DRAFT;
    }
}

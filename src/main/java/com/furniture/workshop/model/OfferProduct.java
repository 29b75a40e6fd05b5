package com.furniture.workshop.model;

import jakarta.persistence.*;
import lombok.Data;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Entity
@Table(name = "offer_products")
@Data
public class OfferProduct {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String offerId;

    private String productId;
    private String productName;

    private Integer quantity;

    private boolean included = true;

    @Column(precision = 19, scale = 4)
    private BigDecimal materialCost;

    @Column(precision = 19, scale = 4)
    private BigDecimal margin; // percent on top of material cost

    @Column(precision = 19, scale = 4)
    private BigDecimal sellingPrice;

    @Column(precision = 19, scale = 4)
    private BigDecimal totalPrice;

    @Transient
    private List<OfferExtra> extras = new ArrayList<>();
}

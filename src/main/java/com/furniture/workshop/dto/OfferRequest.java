package com.furniture.workshop.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record OfferRequest(String projectId, LocalDate validUntil, BigDecimal transportCost, boolean onsiteAssembly,
        BigDecimal onsiteDiscount, String notes, List<OfferProductRequest> products) {

    /** {@code margin} is a percentage added on top of the product's material cost. */
    public record OfferProductRequest(String productId, Integer quantity, BigDecimal margin, boolean included,
            List<OfferExtraRequest> extras) {
    }

    public record OfferExtraRequest(String name, BigDecimal quantity, String unit, BigDecimal unitPrice) {
    }
}

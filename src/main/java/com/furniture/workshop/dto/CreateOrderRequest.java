package com.furniture.workshop.dto;

import java.time.LocalDate;
import java.util.List;

public record CreateOrderRequest(String supplierId, String supplierName, LocalDate expectedDelivery, String notes,
        List<String> materialIds) {
}

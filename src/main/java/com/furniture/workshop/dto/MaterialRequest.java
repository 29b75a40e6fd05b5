package com.furniture.workshop.dto;

import java.math.BigDecimal;

public record MaterialRequest(String materialId, String materialName, String category, BigDecimal quantity,
        String unit, BigDecimal unitPrice, String supplier, boolean essential) {
}

package com.furniture.workshop.dto;

import java.math.BigDecimal;
import java.util.List;

public record AluDoorMaterialRequest(String materialName, String supplier, boolean essential,
        List<AluDoorItemRequest> items) {

    public record AluDoorItemRequest(int qty, int width, int height, String frameType, String glassType,
            String frameColor, String hingeColor, String hingeType, String hingeSide, boolean integratedHandle,
            BigDecimal unitPrice, String note) {
    }
}

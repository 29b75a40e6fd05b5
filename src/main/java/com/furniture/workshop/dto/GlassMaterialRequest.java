package com.furniture.workshop.dto;

import java.math.BigDecimal;
import java.util.List;

public record GlassMaterialRequest(String materialName, String supplier, BigDecimal pricePerM2, boolean essential,
        List<GlassItemRequest> items) {

    public record GlassItemRequest(int qty, int width, int height, boolean edgeProcessing, String note) {
    }
}

package com.furniture.workshop.dto;

import com.furniture.workshop.model.OrderDisplayStatus;

import java.util.List;

public record ReceiveItemsResult(int receivedCount, OrderDisplayStatus orderStatus,
        List<String> productsMaterialsReady) {
}

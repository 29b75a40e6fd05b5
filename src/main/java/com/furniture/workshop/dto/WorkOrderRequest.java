package com.furniture.workshop.dto;

import com.furniture.workshop.model.ProcessAssignment;
import com.furniture.workshop.model.ProductionStep;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/** Missing {@code productionSteps} fall back to the tenant's configured steps. */
public record WorkOrderRequest(LocalDate dueDate, String notes, List<ProductionStep> productionSteps,
        List<WorkOrderItemRequest> items) {

    public record WorkOrderItemRequest(String productId, Integer quantity, BigDecimal productValue,
            BigDecimal plannedLaborCost, List<ProcessAssignment> processes) {
    }
}

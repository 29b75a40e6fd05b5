package com.furniture.workshop.dto;

import java.math.BigDecimal;
import java.util.List;

public record LaborCostSummary(String workOrderItemId, BigDecimal totalCost, List<WorkerLaborCost> workers) {

    public record WorkerLaborCost(String workerId, String workerName, int days, BigDecimal cost) {
    }
}

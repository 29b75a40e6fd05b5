package com.furniture.workshop.dto;

import com.furniture.workshop.model.ProductionStep;

import java.math.BigDecimal;
import java.time.LocalDate;

/** {@code dailyRate} defaults to the worker's rate, {@code workDate} to today. */
public record WorkLogRequest(String workerId, String workOrderItemId, LocalDate workDate, ProductionStep processName,
        BigDecimal dailyRate, String notes) {
}

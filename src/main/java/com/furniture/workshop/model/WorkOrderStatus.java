package com.furniture.workshop.model;

public enum WorkOrderStatus {
    WAITING,
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED
}

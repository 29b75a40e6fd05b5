package com.furniture.workshop.model;

public enum WorkOrderItemStatus {
    WAITING,
    IN_PROGRESS,
    COMPLETED
}

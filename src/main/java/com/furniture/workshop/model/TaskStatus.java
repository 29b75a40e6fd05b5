package com.furniture.workshop.model;

public enum TaskStatus {
    OPEN,
    IN_PROGRESS,
    DONE
}

package com.furniture.workshop.model;

public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}

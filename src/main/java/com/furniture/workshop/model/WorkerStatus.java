package com.furniture.workshop.model;

public enum WorkerStatus {
    ACTIVE,
    INACTIVE
}

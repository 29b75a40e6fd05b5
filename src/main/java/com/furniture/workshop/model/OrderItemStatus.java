package com.furniture.workshop.model;

public enum OrderItemStatus {
    PENDING,
    ORDERED,
    RECEIVED
}

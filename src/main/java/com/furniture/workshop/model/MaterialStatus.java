package com.furniture.workshop.model;

public enum MaterialStatus {
    NOT_ORDERED,
    ORDERED,
    RECEIVED,
    ON_STOCK,
    IN_USE,
    INSTALLED
}

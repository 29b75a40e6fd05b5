package com.furniture.workshop.model;

public enum OrderDisplayStatus {
    DRAFT,
    SENT,
    PARTIALLY_RECEIVED,
    RECEIVED
}

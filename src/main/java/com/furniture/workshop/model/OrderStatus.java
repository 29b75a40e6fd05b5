package com.furniture.workshop.model;

/**
 * Persisted purchase order states. Partial reception is never stored, see
 * {@link OrderDisplayStatus}.
 */
public enum OrderStatus {
    DRAFT,
    SENT,
    RECEIVED
}

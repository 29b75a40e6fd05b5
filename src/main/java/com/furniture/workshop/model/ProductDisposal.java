package com.furniture.workshop.model;

/** What happens to products when their work order is deleted. */
public enum ProductDisposal {
    COMPLETED,
    WAITING
}

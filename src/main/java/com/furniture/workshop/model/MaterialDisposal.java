package com.furniture.workshop.model;

/** What happens to outstanding materials when their purchase order is deleted. */
public enum MaterialDisposal {
    RESET,
    MARK_RECEIVED
}

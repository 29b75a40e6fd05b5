package com.furniture.workshop.model;

public enum ProductStatus {
    WAITING,
    MATERIALS_ORDERED,
    MATERIALS_READY,
    WAITING_FOR_PRODUCTION,
    CUTTING,
    EDGING,
    DRILLING,
    ASSEMBLY,
    READY,
    INSTALLED;

    public boolean isInProduction() {
        return this == CUTTING || this == EDGING || this == DRILLING || this == ASSEMBLY;
    }

    public boolean isFinished() {
        return this == READY || this == INSTALLED;
    }
}

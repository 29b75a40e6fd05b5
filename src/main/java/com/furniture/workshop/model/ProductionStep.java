package com.furniture.workshop.model;

public enum ProductionStep {
    CUTTING(ProductStatus.CUTTING),
    EDGING(ProductStatus.EDGING),
    DRILLING(ProductStatus.DRILLING),
    ASSEMBLY(ProductStatus.ASSEMBLY);

    private final ProductStatus productStatus;

    ProductionStep(ProductStatus productStatus) {
        this.productStatus = productStatus;
    }

    /** Status a product carries while this step is being worked on. */
    public ProductStatus getProductStatus() {
        return productStatus;
    }
}

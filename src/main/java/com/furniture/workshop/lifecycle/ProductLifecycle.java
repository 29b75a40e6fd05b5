package com.furniture.workshop.lifecycle;

import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.ProductDisposal;
import com.furniture.workshop.model.ProductMaterial;
import com.furniture.workshop.model.ProductStatus;
import com.furniture.workshop.model.ProductionStep;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Component
public class ProductLifecycle {

    // Completed step -> status the product moves to; anything unmapped ends in READY
    private static final Map<ProductionStep, ProductStatus> NEXT_AFTER = new EnumMap<>(ProductionStep.class);

    static {
        NEXT_AFTER.put(ProductionStep.CUTTING, ProductStatus.EDGING);
        NEXT_AFTER.put(ProductionStep.EDGING, ProductStatus.DRILLING);
        NEXT_AFTER.put(ProductionStep.DRILLING, ProductStatus.ASSEMBLY);
        NEXT_AFTER.put(ProductionStep.ASSEMBLY, ProductStatus.READY);
    }

    private final MaterialLifecycle materialLifecycle;

    public ProductLifecycle(MaterialLifecycle materialLifecycle) {
        this.materialLifecycle = materialLifecycle;
    }

    /**
     * Status after {@code completed} is done. Follows the work order's own step
     * list when it contains the step, otherwise the default chain.
     */
    public ProductStatus nextAfter(ProductionStep completed, List<ProductionStep> steps) {
        int idx = steps != null ? steps.indexOf(completed) : -1;
        if (idx >= 0) {
            return idx + 1 < steps.size() ? steps.get(idx + 1).getProductStatus() : ProductStatus.READY;
        }
        return NEXT_AFTER.getOrDefault(completed, ProductStatus.READY);
    }

    public boolean onMaterialsOrdered(Product product) {
        if (product.getStatus() != ProductStatus.WAITING)
            return false;
        product.setStatus(ProductStatus.MATERIALS_ORDERED);
        return true;
    }

    /**
     * Promotes to MATERIALS_READY when every material is received, in use or
     * installed. Only products still waiting on materials move.
     */
    public boolean onMaterialsChanged(Product product, List<ProductMaterial> materials) {
        if (product.getStatus() != ProductStatus.WAITING && product.getStatus() != ProductStatus.MATERIALS_ORDERED)
            return false;
        if (materials.isEmpty())
            return false;
        boolean allReady = materials.stream().allMatch(m -> materialLifecycle.isReadyForProduct(m.getStatus()));
        if (!allReady)
            return false;
        product.setStatus(ProductStatus.MATERIALS_READY);
        return true;
    }

    /**
     * Puts a product on its first production step. Products already in
     * production or finished keep their status, so a repeated start is a no-op.
     */
    public boolean startProduction(Product product, ProductionStep firstStep) {
        ProductStatus current = product.getStatus();
        if (current != null && (current.isInProduction() || current.isFinished()))
            return false;
        return moveTo(product, firstStep.getProductStatus());
    }

    /**
     * Moves forward only; finished products and backward moves are ignored.
     */
    public boolean advanceTo(Product product, ProductStatus next) {
        ProductStatus current = product.getStatus();
        if (current == null || current.isFinished() || next.ordinal() <= current.ordinal())
            return false;
        product.setStatus(next);
        return true;
    }

    public boolean moveTo(Product product, ProductStatus status) {
        if (product.getStatus() == status)
            return false;
        product.setStatus(status);
        return true;
    }

    public boolean dispose(Product product, ProductDisposal disposal) {
        return moveTo(product,
                disposal == ProductDisposal.COMPLETED ? ProductStatus.READY : ProductStatus.WAITING_FOR_PRODUCTION);
    }
}

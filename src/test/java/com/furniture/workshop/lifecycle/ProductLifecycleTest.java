package com.furniture.workshop.lifecycle;

import com.furniture.workshop.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProductLifecycleTest {

    private final ProductLifecycle lifecycle = new ProductLifecycle(new MaterialLifecycle());

    private static Product product(ProductStatus status) {
        Product p = new Product();
        p.setStatus(status);
        return p;
    }

    private static ProductMaterial material(MaterialStatus status) {
        ProductMaterial m = new ProductMaterial();
        m.setStatus(status);
        return m;
    }

    @Test
    void nextAfter_followsWorkOrderSteps() {
        List<ProductionStep> steps = List.of(ProductionStep.CUTTING, ProductionStep.ASSEMBLY);

        assertEquals(ProductStatus.ASSEMBLY, lifecycle.nextAfter(ProductionStep.CUTTING, steps));
        assertEquals(ProductStatus.READY, lifecycle.nextAfter(ProductionStep.ASSEMBLY, steps));
    }

    @Test
    void nextAfter_fallsBackToDefaultChain() {
        assertEquals(ProductStatus.EDGING, lifecycle.nextAfter(ProductionStep.CUTTING, List.of()));
        assertEquals(ProductStatus.READY, lifecycle.nextAfter(ProductionStep.ASSEMBLY, null));
    }

    @Test
    void materialsChanged_promotesWhenAllInHand() {
        Product p = product(ProductStatus.MATERIALS_ORDERED);

        assertFalse(lifecycle.onMaterialsChanged(p,
                List.of(material(MaterialStatus.RECEIVED), material(MaterialStatus.ORDERED))));
        assertTrue(lifecycle.onMaterialsChanged(p,
                List.of(material(MaterialStatus.RECEIVED), material(MaterialStatus.IN_USE))));
        assertEquals(ProductStatus.MATERIALS_READY, p.getStatus());
    }

    @Test
    void materialsChanged_ignoresProductsInProduction() {
        Product p = product(ProductStatus.CUTTING);

        assertFalse(lifecycle.onMaterialsChanged(p, List.of(material(MaterialStatus.RECEIVED))));
        assertEquals(ProductStatus.CUTTING, p.getStatus());
    }

    @Test
    void advanceTo_neverMovesBackwards() {
        Product p = product(ProductStatus.DRILLING);

        assertFalse(lifecycle.advanceTo(p, ProductStatus.EDGING));
        assertTrue(lifecycle.advanceTo(p, ProductStatus.ASSEMBLY));
        assertEquals(ProductStatus.ASSEMBLY, p.getStatus());
    }

    @Test
    void advanceTo_leavesFinishedProducts() {
        Product p = product(ProductStatus.INSTALLED);

        assertFalse(lifecycle.advanceTo(p, ProductStatus.READY));
        assertEquals(ProductStatus.INSTALLED, p.getStatus());
    }

    @Test
    void startProduction_movesWaitingProductsToFirstStep() {
        Product ready = product(ProductStatus.MATERIALS_READY);
        Product parked = product(ProductStatus.WAITING_FOR_PRODUCTION);

        assertTrue(lifecycle.startProduction(ready, ProductionStep.CUTTING));
        assertTrue(lifecycle.startProduction(parked, ProductionStep.EDGING));
        assertEquals(ProductStatus.CUTTING, ready.getStatus());
        assertEquals(ProductStatus.EDGING, parked.getStatus());
    }

    @Test
    void startProduction_keepsProductsAlreadyInProductionOrFinished() {
        Product assembling = product(ProductStatus.ASSEMBLY);
        Product done = product(ProductStatus.READY);

        assertFalse(lifecycle.startProduction(assembling, ProductionStep.CUTTING));
        assertFalse(lifecycle.startProduction(done, ProductionStep.CUTTING));
        assertEquals(ProductStatus.ASSEMBLY, assembling.getStatus());
        assertEquals(ProductStatus.READY, done.getStatus());
    }

    @Test
    void dispose_mapsDisposalToStatus() {
        Product done = product(ProductStatus.EDGING);
        Product back = product(ProductStatus.EDGING);

        lifecycle.dispose(done, ProductDisposal.COMPLETED);
        lifecycle.dispose(back, ProductDisposal.WAITING);

        assertEquals(ProductStatus.READY, done.getStatus());
        assertEquals(ProductStatus.WAITING_FOR_PRODUCTION, back.getStatus());
    }
}

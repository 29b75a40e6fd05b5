package com.furniture.workshop.lifecycle;

import com.furniture.workshop.model.MaterialStatus;
import com.furniture.workshop.model.ProductMaterial;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

import static com.furniture.workshop.model.MaterialStatus.*;

/**
 * Legal moves of a product material. Every mutator returns {@code true} only
 * when the material actually changed, so callers save only what moved.
 * Order-flow mutators leave materials that are already received untouched.
 */
@Component
public class MaterialLifecycle {

    private static final TransitionTable<MaterialStatus, MaterialEvent> TABLE = TransitionTable
            .builder("material", MaterialStatus.class, MaterialEvent.class)
            .allow(NOT_ORDERED, MaterialEvent.ORDER, ORDERED)
            .allow(ORDERED, MaterialEvent.RECEIVE, RECEIVED)
            .allow(NOT_ORDERED, MaterialEvent.RECEIVE, RECEIVED)
            .allow(ORDERED, MaterialEvent.GIVE_BACK, NOT_ORDERED)
            .allow(RECEIVED, MaterialEvent.STOCK, ON_STOCK)
            .allow(RECEIVED, MaterialEvent.USE, IN_USE)
            .allow(ON_STOCK, MaterialEvent.USE, IN_USE)
            .allow(IN_USE, MaterialEvent.INSTALL, INSTALLED)
            .build();

    // Statuses that let a product count as having all its materials
    private static final Set<MaterialStatus> READY_FOR_PRODUCT = EnumSet.of(RECEIVED, IN_USE, INSTALLED);

    // Statuses that let an essential material unblock a work order
    private static final Set<MaterialStatus> ESSENTIAL_READY = EnumSet.of(RECEIVED, ON_STOCK);

    public boolean order(ProductMaterial material, String orderId, BigDecimal orderedQuantity) {
        if (!isOutstanding(material.getStatus()))
            return false;
        MaterialStatus next = TABLE.fire(material.getStatus(), MaterialEvent.ORDER);
        boolean changed = next != material.getStatus()
                || !orderId.equals(material.getOrderId())
                || material.getOrderedQuantity() == null;
        material.setStatus(next);
        material.setOrderId(orderId);
        if (material.getOrderedQuantity() == null)
            material.setOrderedQuantity(orderedQuantity);
        return changed;
    }

    public boolean receive(ProductMaterial material, LocalDateTime at) {
        if (!isOutstanding(material.getStatus()))
            return false;
        MaterialStatus next = TABLE.fire(material.getStatus(), MaterialEvent.RECEIVE);
        if (next == material.getStatus())
            return false;
        material.setStatus(next);
        material.setReceivedAt(at);
        return true;
    }

    /** Undoes an order: back to NOT_ORDERED and no order reference. */
    public boolean giveBack(ProductMaterial material) {
        if (!isOutstanding(material.getStatus()))
            return false;
        MaterialStatus next = TABLE.fire(material.getStatus(), MaterialEvent.GIVE_BACK);
        boolean changed = next != material.getStatus() || material.getOrderId() != null;
        material.setStatus(next);
        material.setOrderId(null);
        material.setOrderedQuantity(null);
        return changed;
    }

    /**
     * Back to NOT_ORDERED while staying attached to its (now draft) order.
     */
    public boolean revertToPending(ProductMaterial material) {
        if (!isOutstanding(material.getStatus()))
            return false;
        MaterialStatus next = TABLE.fire(material.getStatus(), MaterialEvent.GIVE_BACK);
        boolean changed = next != material.getStatus() || material.getOrderedQuantity() != null;
        material.setStatus(next);
        material.setOrderedQuantity(null);
        return changed;
    }

    public boolean fire(ProductMaterial material, MaterialEvent event) {
        MaterialStatus next = TABLE.fire(material.getStatus(), event);
        if (next == material.getStatus())
            return false;
        material.setStatus(next);
        return true;
    }

    public boolean canFire(MaterialStatus status, MaterialEvent event) {
        return TABLE.canFire(status, event);
    }

    /** Not received yet, so an order deletion still has to dispose of it. */
    public boolean isOutstanding(MaterialStatus status) {
        return status == NOT_ORDERED || status == ORDERED;
    }

    public boolean isReadyForProduct(MaterialStatus status) {
        return READY_FOR_PRODUCT.contains(status);
    }

    public boolean isEssentialReady(MaterialStatus status) {
        return ESSENTIAL_READY.contains(status);
    }
}

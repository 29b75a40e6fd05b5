package com.furniture.workshop.service;

import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.ProductMaterial;
import com.furniture.workshop.model.PurchaseOrder;
import com.furniture.workshop.model.PurchaseOrderItem;
import com.furniture.workshop.repository.ProductMaterialRepository;
import com.furniture.workshop.repository.ProductRepository;
import com.furniture.workshop.repository.PurchaseOrderItemRepository;
import com.furniture.workshop.repository.PurchaseOrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Recomputes derived totals from freshly read children. Running either
 * recalculation twice in a row leaves the stored total unchanged.
 */
@Service
public class AggregateRecalculator {

    private static final Logger logger = LoggerFactory.getLogger(AggregateRecalculator.class);

    private final ProductRepository productRepository;
    private final ProductMaterialRepository materialRepository;
    private final PurchaseOrderRepository orderRepository;
    private final PurchaseOrderItemRepository itemRepository;

    public AggregateRecalculator(ProductRepository productRepository, ProductMaterialRepository materialRepository,
            PurchaseOrderRepository orderRepository, PurchaseOrderItemRepository itemRepository) {
        this.productRepository = productRepository;
        this.materialRepository = materialRepository;
        this.orderRepository = orderRepository;
        this.itemRepository = itemRepository;
    }

    public static BigDecimal materialCost(List<ProductMaterial> materials) {
        return materials.stream()
                .map(ProductMaterial::getTotalPrice)
                .filter(p -> p != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public static BigDecimal orderTotal(List<PurchaseOrderItem> items) {
        return items.stream()
                .map(i -> nz(i.getQuantity()).multiply(nz(i.getExpectedPrice())))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** @return the new material cost, or {@code null} when the product is gone */
    public BigDecimal recalculateProductCost(String tenantId, String productId) {
        Product product = productRepository.findByIdAndTenantId(productId, tenantId).orElse(null);
        if (product == null) {
            logger.debug("Product {} vanished before cost recalculation", productId);
            return null;
        }
        BigDecimal cost = materialCost(materialRepository.findByTenantIdAndProductId(tenantId, productId));
        if (product.getMaterialCost() == null || product.getMaterialCost().compareTo(cost) != 0) {
            product.setMaterialCost(cost);
            productRepository.save(product);
        }
        return cost;
    }

    /** @return the new order total, or {@code null} when the order is gone */
    public BigDecimal recalculateOrderTotal(String tenantId, String orderId) {
        PurchaseOrder order = orderRepository.findByIdAndTenantId(orderId, tenantId).orElse(null);
        if (order == null) {
            logger.debug("Order {} vanished before total recalculation", orderId);
            return null;
        }
        BigDecimal total = orderTotal(itemRepository.findByTenantIdAndOrderId(tenantId, orderId));
        if (order.getTotalAmount() == null || order.getTotalAmount().compareTo(total) != 0) {
            order.setTotalAmount(total);
            orderRepository.save(order);
        }
        return total;
    }

    private static BigDecimal nz(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}

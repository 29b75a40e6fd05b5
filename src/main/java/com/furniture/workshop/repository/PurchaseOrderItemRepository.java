package com.furniture.workshop.repository;

import com.furniture.workshop.model.PurchaseOrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;

public interface PurchaseOrderItemRepository extends JpaRepository<PurchaseOrderItem, String> {
    List<PurchaseOrderItem> findByTenantId(String tenantId);

    List<PurchaseOrderItem> findByTenantIdAndOrderId(String tenantId, String orderId);

    List<PurchaseOrderItem> findByTenantIdAndOrderIdAndIdIn(String tenantId, String orderId, Collection<String> ids);
}

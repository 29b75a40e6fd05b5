package com.furniture.workshop.repository;

import com.furniture.workshop.model.OrderStatus;
import com.furniture.workshop.model.PurchaseOrder;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface PurchaseOrderRepository extends JpaRepository<PurchaseOrder, String> {
    List<PurchaseOrder> findByTenantId(String tenantId);

    Optional<PurchaseOrder> findByIdAndTenantId(String id, String tenantId);

    List<PurchaseOrder> findByTenantIdAndStatus(String tenantId, OrderStatus status);
}

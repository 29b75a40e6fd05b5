package com.furniture.workshop.repository;

import com.furniture.workshop.model.WorkOrderItem;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkOrderItemRepository extends JpaRepository<WorkOrderItem, String> {
    List<WorkOrderItem> findByTenantId(String tenantId);

    Optional<WorkOrderItem> findByIdAndTenantId(String id, String tenantId);

    List<WorkOrderItem> findByTenantIdAndWorkOrderId(String tenantId, String workOrderId);

    List<WorkOrderItem> findByTenantIdAndWorkOrderIdIn(String tenantId, Collection<String> workOrderIds);
}

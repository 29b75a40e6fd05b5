package com.furniture.workshop.repository;

import com.furniture.workshop.model.WorkOrder;
import com.furniture.workshop.model.WorkOrderStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface WorkOrderRepository extends JpaRepository<WorkOrder, String> {
    List<WorkOrder> findByTenantId(String tenantId);

    Optional<WorkOrder> findByIdAndTenantId(String id, String tenantId);

    List<WorkOrder> findByTenantIdAndStatusIn(String tenantId, Collection<WorkOrderStatus> statuses);
}

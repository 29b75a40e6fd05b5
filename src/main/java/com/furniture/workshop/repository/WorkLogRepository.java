package com.furniture.workshop.repository;

import com.furniture.workshop.model.WorkLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface WorkLogRepository extends JpaRepository<WorkLog, String> {
    List<WorkLog> findByTenantId(String tenantId);

    Optional<WorkLog> findByIdAndTenantId(String id, String tenantId);

    boolean existsByTenantIdAndWorkerIdAndWorkOrderItemIdAndWorkDate(String tenantId, String workerId,
            String workOrderItemId, LocalDate workDate);

    List<WorkLog> findByTenantIdAndWorkOrderItemIdOrderByWorkDateAsc(String tenantId, String workOrderItemId);

    List<WorkLog> findByTenantIdAndWorkOrderIdOrderByWorkDateAsc(String tenantId, String workOrderId);
}

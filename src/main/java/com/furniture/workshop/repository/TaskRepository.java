package com.furniture.workshop.repository;

import com.furniture.workshop.model.Task;
import com.furniture.workshop.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface TaskRepository extends JpaRepository<Task, String> {
    List<Task> findByTenantId(String tenantId);

    Optional<Task> findByIdAndTenantId(String id, String tenantId);

    List<Task> findByTenantIdAndRelatedWorkOrderId(String tenantId, String relatedWorkOrderId);

    boolean existsByTenantIdAndRelatedWorkOrderIdAndRelatedMaterialIdAndStatusNot(String tenantId,
            String relatedWorkOrderId, String relatedMaterialId, TaskStatus status);
}

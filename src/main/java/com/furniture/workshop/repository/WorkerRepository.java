package com.furniture.workshop.repository;

import com.furniture.workshop.model.Worker;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface WorkerRepository extends JpaRepository<Worker, String> {
    List<Worker> findByTenantIdOrderByNameAsc(String tenantId);

    Optional<Worker> findByIdAndTenantId(String id, String tenantId);
}

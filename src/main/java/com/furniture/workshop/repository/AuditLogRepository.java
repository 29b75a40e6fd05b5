package com.furniture.workshop.repository;

import com.furniture.workshop.model.AuditLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {
    List<AuditLog> findTop50ByTenantIdOrderByTimestampDesc(String tenantId);
}

package com.furniture.workshop.repository;

import com.furniture.workshop.model.WorkerAttendance;
import org.springframework.data.jpa.repository.JpaRepository;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface WorkerAttendanceRepository extends JpaRepository<WorkerAttendance, String> {
    Optional<WorkerAttendance> findByTenantIdAndWorkerIdAndWorkDate(String tenantId, String workerId,
            LocalDate workDate);

    List<WorkerAttendance> findByTenantIdAndWorkDate(String tenantId, LocalDate workDate);
}

package com.furniture.workshop.service;

import com.furniture.workshop.dto.AttendanceRequest;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.dto.WorkerAvailability;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.Worker;
import com.furniture.workshop.model.WorkerAttendance;
import com.furniture.workshop.model.WorkerStatus;
import com.furniture.workshop.repository.WorkerAttendanceRepository;
import com.furniture.workshop.repository.WorkerRepository;
import com.furniture.workshop.util.Messages;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Availability from today's attendance sheet. A worker without an entry for
 * today counts as available.
 */
@Service
public class DefaultAttendanceService implements AttendanceService {

    private final WorkerRepository workerRepository;
    private final WorkerAttendanceRepository attendanceRepository;
    private final OperationRunner runner;
    private final Messages messages;
    private final Clock clock;

    public DefaultAttendanceService(WorkerRepository workerRepository,
            WorkerAttendanceRepository attendanceRepository, OperationRunner runner, Messages messages,
            Clock clock) {
        this.workerRepository = workerRepository;
        this.attendanceRepository = attendanceRepository;
        this.runner = runner;
        this.messages = messages;
        this.clock = clock;
    }

    @Override
    public WorkerAvailability canWorkerStart(TenantContext ctx, String workerId) {
        Optional<Worker> worker = workerRepository.findByIdAndTenantId(workerId, ctx.tenantId());
        if (worker.isEmpty())
            return WorkerAvailability.unavailable(messages.get("attendance.unknown-worker"));
        if (worker.get().getStatus() == WorkerStatus.INACTIVE)
            return WorkerAvailability.unavailable(messages.get("attendance.inactive"));

        return attendanceRepository.findByTenantIdAndWorkerIdAndWorkDate(ctx.tenantId(), workerId, LocalDate.now(clock))
                .filter(a -> !a.getStatus().isWorking())
                .map(a -> WorkerAvailability.unavailable(messages.get("attendance.status." + a.getStatus().name())))
                .orElse(WorkerAvailability.available());
    }

    public OperationResult<WorkerAttendance> record(TenantContext ctx, String workerId, AttendanceRequest req) {
        return runner.run(ctx, "recordAttendance", () -> {
            if (req == null || req.status() == null)
                throw new WorkshopException("attendance.status-required");
            workerRepository.findByIdAndTenantId(workerId, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("worker", workerId));
            LocalDate day = req.workDate() != null ? req.workDate() : LocalDate.now(clock);

            WorkerAttendance entry = attendanceRepository
                    .findByTenantIdAndWorkerIdAndWorkDate(ctx.tenantId(), workerId, day)
                    .orElseGet(() -> {
                        WorkerAttendance a = new WorkerAttendance();
                        a.setTenantId(ctx.tenantId());
                        a.setWorkerId(workerId);
                        a.setWorkDate(day);
                        return a;
                    });
            entry.setStatus(req.status());
            entry.setNote(req.note());
            return OperationResult.ok(attendanceRepository.save(entry), messages.get("attendance.recorded"));
        });
    }
}

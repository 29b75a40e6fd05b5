package com.furniture.workshop.controller;

import com.furniture.workshop.dto.AttendanceRequest;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.dto.WorkerAvailability;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.Worker;
import com.furniture.workshop.model.WorkerAttendance;
import com.furniture.workshop.repository.WorkerRepository;
import com.furniture.workshop.service.DefaultAttendanceService;
import com.furniture.workshop.service.OperationRunner;
import com.furniture.workshop.util.Messages;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/workers")
public class WorkerController {

    private final WorkerRepository workerRepository;
    private final DefaultAttendanceService attendanceService;
    private final OperationRunner runner;
    private final Messages messages;

    public WorkerController(WorkerRepository workerRepository, DefaultAttendanceService attendanceService,
            OperationRunner runner, Messages messages) {
        this.workerRepository = workerRepository;
        this.attendanceService = attendanceService;
        this.runner = runner;
        this.messages = messages;
    }

    @GetMapping
    public ResponseEntity<OperationResult<List<Worker>>> list(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "listWorkers",
                () -> OperationResult.ok(workerRepository.findByTenantIdOrderByNameAsc(ctx.tenantId()), "")));
    }

    @PostMapping
    public ResponseEntity<OperationResult<Worker>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody Worker worker) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "createWorker", () -> {
            worker.setId(null);
            return save(ctx, worker);
        }));
    }

    @PutMapping("/{id}")
    public ResponseEntity<OperationResult<Worker>> update(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody Worker worker) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "updateWorker", () -> {
            workerRepository.findByIdAndTenantId(id, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("worker", id));
            worker.setId(id);
            return save(ctx, worker);
        }));
    }

    private OperationResult<Worker> save(TenantContext ctx, Worker worker) {
        if (worker.getName() == null || worker.getName().isBlank())
            throw new WorkshopException("worker.name-required");
        worker.setTenantId(ctx.tenantId());
        Worker saved = workerRepository.save(worker);
        return OperationResult.ok(saved, messages.get("worker.saved", saved.getName()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "deleteWorker", () -> {
            Worker worker = workerRepository.findByIdAndTenantId(id, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("worker", id));
            workerRepository.delete(worker);
            return OperationResult.ok(null, messages.get("worker.deleted", worker.getName()));
        }));
    }

    @PostMapping("/{id}/attendance")
    public ResponseEntity<OperationResult<WorkerAttendance>> recordAttendance(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody AttendanceRequest request) {
        return ApiResponses.of(attendanceService.record(TenantContext.of(tenantId, principal), id, request));
    }

    @GetMapping("/{id}/availability")
    public ResponseEntity<OperationResult<WorkerAvailability>> availability(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "workerAvailability",
                () -> OperationResult.ok(attendanceService.canWorkerStart(ctx, id), "")));
    }
}

package com.furniture.workshop.controller;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.Task;
import com.furniture.workshop.model.TaskStatus;
import com.furniture.workshop.repository.TaskRepository;
import com.furniture.workshop.service.OperationRunner;
import com.furniture.workshop.util.Messages;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskRepository taskRepository;
    private final OperationRunner runner;
    private final Messages messages;

    public TaskController(TaskRepository taskRepository, OperationRunner runner, Messages messages) {
        this.taskRepository = taskRepository;
        this.runner = runner;
        this.messages = messages;
    }

    @GetMapping
    public ResponseEntity<OperationResult<List<Task>>> list(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestParam(required = false) String workOrderId) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "listTasks", () -> OperationResult.ok(workOrderId != null
                ? taskRepository.findByTenantIdAndRelatedWorkOrderId(ctx.tenantId(), workOrderId)
                : taskRepository.findByTenantId(ctx.tenantId()), "")));
    }

    @PostMapping
    public ResponseEntity<OperationResult<Task>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody Task task) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "createTask", () -> {
            if (task.getTitle() == null || task.getTitle().isBlank())
                throw new WorkshopException("task.title-required");
            task.setId(null);
            task.setTenantId(ctx.tenantId());
            task.setAutoGenerated(false);
            Task saved = taskRepository.save(task);
            return OperationResult.ok(saved, messages.get("task.saved", saved.getTitle()));
        }));
    }

    @PostMapping("/{id}/status")
    public ResponseEntity<OperationResult<Task>> changeStatus(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestParam TaskStatus status) {
        TenantContext ctx = TenantContext.of(tenantId, principal);
        return ApiResponses.of(runner.run(ctx, "changeTaskStatus", () -> {
            Task task = taskRepository.findByIdAndTenantId(id, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("task", id));
            task.setStatus(status);
            Task saved = taskRepository.save(task);
            return OperationResult.ok(saved, messages.get("task.status-changed", saved.getTitle(), status));
        }));
    }
}

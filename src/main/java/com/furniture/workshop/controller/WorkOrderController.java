package com.furniture.workshop.controller;

import com.furniture.workshop.dto.*;
import com.furniture.workshop.model.ProductDisposal;
import com.furniture.workshop.model.ProductionStep;
import com.furniture.workshop.model.WorkLog;
import com.furniture.workshop.model.WorkOrder;
import com.furniture.workshop.model.WorkOrderItem;
import com.furniture.workshop.service.WorkLogService;
import com.furniture.workshop.service.WorkOrderService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.Principal;
import java.util.List;

import static com.furniture.workshop.controller.ApiResponses.TENANT_HEADER;

@RestController
@RequestMapping("/api/work-orders")
public class WorkOrderController {

    private final WorkOrderService workOrderService;
    private final WorkLogService workLogService;

    public WorkOrderController(WorkOrderService workOrderService, WorkLogService workLogService) {
        this.workOrderService = workOrderService;
        this.workLogService = workLogService;
    }

    @GetMapping("/{id}")
    public ResponseEntity<OperationResult<WorkOrder>> get(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(workOrderService.getWorkOrder(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping
    public ResponseEntity<OperationResult<WorkOrder>> create(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody WorkOrderRequest request) {
        return ApiResponses.of(workOrderService.createWorkOrder(TenantContext.of(tenantId, principal), request));
    }

    @PostMapping("/{id}/start")
    public ResponseEntity<OperationResult<WorkOrder>> start(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(workOrderService.startWorkOrder(TenantContext.of(tenantId, principal), id));
    }

    @PostMapping("/{id}/items/{itemId}/complete")
    public ResponseEntity<OperationResult<WorkOrderItem>> completeStep(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @PathVariable String itemId, @RequestParam ProductionStep step) {
        return ApiResponses.of(workOrderService.completeItemStep(TenantContext.of(tenantId, principal), id, itemId,
                step));
    }

    @PostMapping("/{id}/schedule")
    public ResponseEntity<OperationResult<ScheduleResult>> schedule(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestBody ScheduleRequest request) {
        return ApiResponses.of(workOrderService.scheduleWorkOrder(TenantContext.of(tenantId, principal), id,
                request));
    }

    @PostMapping("/{id}/unschedule")
    public ResponseEntity<OperationResult<WorkOrder>> unschedule(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(workOrderService.unscheduleWorkOrder(TenantContext.of(tenantId, principal), id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<OperationResult<Void>> delete(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id, @RequestParam(required = false) ProductDisposal disposal) {
        return ApiResponses.of(workOrderService.deleteWorkOrder(TenantContext.of(tenantId, principal), id,
                disposal));
    }

    @GetMapping("/{id}/work-logs")
    public ResponseEntity<OperationResult<List<WorkLog>>> workLogs(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String id) {
        return ApiResponses.of(workLogService.listByWorkOrder(TenantContext.of(tenantId, principal), id));
    }

    @GetMapping("/items/{itemId}/work-logs")
    public ResponseEntity<OperationResult<List<WorkLog>>> itemWorkLogs(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String itemId) {
        return ApiResponses.of(workLogService.listByItem(TenantContext.of(tenantId, principal), itemId));
    }

    @GetMapping("/items/{itemId}/labor-cost")
    public ResponseEntity<OperationResult<LaborCostSummary>> laborCost(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String itemId) {
        return ApiResponses.of(workLogService.laborCost(TenantContext.of(tenantId, principal), itemId));
    }

    @PostMapping("/work-logs")
    public ResponseEntity<OperationResult<WorkLog>> createWorkLog(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @RequestBody WorkLogRequest request) {
        return ApiResponses.of(workLogService.createWorkLog(TenantContext.of(tenantId, principal), request));
    }

    @DeleteMapping("/work-logs/{workLogId}")
    public ResponseEntity<OperationResult<Void>> deleteWorkLog(
            @RequestHeader(value = TENANT_HEADER, required = false) String tenantId, Principal principal,
            @PathVariable String workLogId) {
        return ApiResponses.of(workLogService.deleteWorkLog(TenantContext.of(tenantId, principal), workLogId));
    }
}

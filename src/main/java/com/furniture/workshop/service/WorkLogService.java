package com.furniture.workshop.service;

import com.furniture.workshop.dto.LaborCostSummary;
import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.dto.WorkLogRequest;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.model.WorkLog;
import com.furniture.workshop.model.WorkOrderItem;
import com.furniture.workshop.model.Worker;
import com.furniture.workshop.repository.WorkLogRepository;
import com.furniture.workshop.repository.WorkOrderItemRepository;
import com.furniture.workshop.repository.WorkerRepository;
import com.furniture.workshop.util.Messages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/** Daily work entries of workers on work order items and the labour cost they add up to. */
@Service
public class WorkLogService {

    private static final Logger logger = LoggerFactory.getLogger(WorkLogService.class);

    private final WorkLogRepository workLogRepository;
    private final WorkOrderItemRepository itemRepository;
    private final WorkerRepository workerRepository;
    private final OperationRunner runner;
    private final Messages messages;
    private final Clock clock;

    public WorkLogService(WorkLogRepository workLogRepository, WorkOrderItemRepository itemRepository,
            WorkerRepository workerRepository, OperationRunner runner, Messages messages, Clock clock) {
        this.workLogRepository = workLogRepository;
        this.itemRepository = itemRepository;
        this.workerRepository = workerRepository;
        this.runner = runner;
        this.messages = messages;
        this.clock = clock;
    }

    public OperationResult<WorkLog> createWorkLog(TenantContext ctx, WorkLogRequest req) {
        return runner.run(ctx, "createWorkLog", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.workerId() == null || req.workOrderItemId() == null)
                throw new WorkshopException("worklog.worker-and-item-required");
            Worker worker = workerRepository.findByIdAndTenantId(req.workerId(), tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("worker", req.workerId()));
            WorkOrderItem item = itemRepository.findByIdAndTenantId(req.workOrderItemId(), tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("work order item", req.workOrderItemId()));
            LocalDate day = req.workDate() != null ? req.workDate() : LocalDate.now(clock);

            if (workLogRepository.existsByTenantIdAndWorkerIdAndWorkOrderItemIdAndWorkDate(tenantId, worker.getId(),
                    item.getId(), day))
                throw new WorkshopException("worklog.duplicate", worker.getName(), day);

            BigDecimal rate = req.dailyRate() != null ? req.dailyRate() : worker.getDailyRate();
            if (rate == null || rate.signum() < 0)
                throw new WorkshopException("worklog.rate-required", worker.getName());

            WorkLog log = new WorkLog();
            log.setTenantId(tenantId);
            log.setWorkerId(worker.getId());
            log.setWorkerName(worker.getName());
            log.setWorkOrderId(item.getWorkOrderId());
            log.setWorkOrderItemId(item.getId());
            log.setProductId(item.getProductId());
            log.setProcessName(req.processName());
            log.setWorkDate(day);
            log.setDailyRate(rate);
            log.setNotes(req.notes());
            WorkLog saved = workLogRepository.save(log);
            logger.debug("Logged {} for worker {} on item {}", day, worker.getId(), item.getId());
            return OperationResult.ok(saved, messages.get("worklog.created", worker.getName(), day));
        });
    }

    public OperationResult<List<WorkLog>> listByItem(TenantContext ctx, String workOrderItemId) {
        return runner.run(ctx, "listWorkLogsByItem", () -> OperationResult.ok(
                workLogRepository.findByTenantIdAndWorkOrderItemIdOrderByWorkDateAsc(ctx.tenantId(), workOrderItemId),
                ""));
    }

    public OperationResult<List<WorkLog>> listByWorkOrder(TenantContext ctx, String workOrderId) {
        return runner.run(ctx, "listWorkLogsByWorkOrder", () -> OperationResult.ok(
                workLogRepository.findByTenantIdAndWorkOrderIdOrderByWorkDateAsc(ctx.tenantId(), workOrderId), ""));
    }

    public OperationResult<Void> deleteWorkLog(TenantContext ctx, String workLogId) {
        return runner.run(ctx, "deleteWorkLog", () -> {
            WorkLog log = workLogRepository.findByIdAndTenantId(workLogId, ctx.tenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("work log", workLogId));
            workLogRepository.delete(log);
            return OperationResult.ok(null, messages.get("worklog.deleted"));
        });
    }

    /** Labour cost of one item: one daily rate per logged day, broken down by worker. */
    public OperationResult<LaborCostSummary> laborCost(TenantContext ctx, String workOrderItemId) {
        return runner.run(ctx, "laborCost", () -> {
            List<WorkLog> logs = workLogRepository
                    .findByTenantIdAndWorkOrderItemIdOrderByWorkDateAsc(ctx.tenantId(), workOrderItemId);
            return OperationResult.ok(summarize(workOrderItemId, logs), "");
        });
    }

    static LaborCostSummary summarize(String workOrderItemId, List<WorkLog> logs) {
        Map<String, List<WorkLog>> byWorker = logs.stream()
                .collect(Collectors.groupingBy(WorkLog::getWorkerId, LinkedHashMap::new, Collectors.toList()));
        List<LaborCostSummary.WorkerLaborCost> workers = new ArrayList<>();
        BigDecimal total = BigDecimal.ZERO;
        for (Map.Entry<String, List<WorkLog>> e : byWorker.entrySet()) {
            BigDecimal cost = e.getValue().stream().map(WorkLog::getDailyRate).reduce(BigDecimal.ZERO,
                    BigDecimal::add);
            workers.add(new LaborCostSummary.WorkerLaborCost(e.getKey(), e.getValue().get(0).getWorkerName(),
                    e.getValue().size(), cost));
            total = total.add(cost);
        }
        return new LaborCostSummary(workOrderItemId, total, workers);
    }
}

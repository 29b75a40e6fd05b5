package com.furniture.workshop.service;

import com.furniture.workshop.dto.*;
import com.furniture.workshop.exception.ResourceNotFoundException;
import com.furniture.workshop.exception.WorkshopException;
import com.furniture.workshop.lifecycle.MaterialLifecycle;
import com.furniture.workshop.lifecycle.ProductLifecycle;
import com.furniture.workshop.lifecycle.ProjectLifecycle;
import com.furniture.workshop.lifecycle.WorkOrderEvent;
import com.furniture.workshop.lifecycle.WorkOrderLifecycle;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.*;
import com.furniture.workshop.util.Messages;
import com.furniture.workshop.util.NumberGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class WorkOrderService {

    private static final Logger logger = LoggerFactory.getLogger(WorkOrderService.class);

    private static final Set<WorkOrderStatus> BOOKED = EnumSet.of(WorkOrderStatus.SCHEDULED,
            WorkOrderStatus.IN_PROGRESS);

    private final WorkOrderRepository workOrderRepository;
    private final WorkOrderItemRepository itemRepository;
    private final ProductRepository productRepository;
    private final ProductMaterialRepository materialRepository;
    private final ProjectRepository projectRepository;
    private final TaskRepository taskRepository;
    private final WorkOrderLifecycle workOrderLifecycle;
    private final ProductLifecycle productLifecycle;
    private final ProjectLifecycle projectLifecycle;
    private final MaterialLifecycle materialLifecycle;
    private final AttendanceService attendanceService;
    private final ProgressCascade progressCascade;
    private final SettingsService settingsService;
    private final CascadeJournal journal;
    private final OperationRunner runner;
    private final AuditService auditService;
    private final Messages messages;
    private final Clock clock;

    public WorkOrderService(WorkOrderRepository workOrderRepository, WorkOrderItemRepository itemRepository,
            ProductRepository productRepository, ProductMaterialRepository materialRepository,
            ProjectRepository projectRepository, TaskRepository taskRepository,
            WorkOrderLifecycle workOrderLifecycle, ProductLifecycle productLifecycle,
            ProjectLifecycle projectLifecycle, MaterialLifecycle materialLifecycle,
            AttendanceService attendanceService, ProgressCascade progressCascade, SettingsService settingsService,
            CascadeJournal journal, OperationRunner runner, AuditService auditService, Messages messages,
            Clock clock) {
        this.workOrderRepository = workOrderRepository;
        this.itemRepository = itemRepository;
        this.productRepository = productRepository;
        this.materialRepository = materialRepository;
        this.projectRepository = projectRepository;
        this.taskRepository = taskRepository;
        this.workOrderLifecycle = workOrderLifecycle;
        this.productLifecycle = productLifecycle;
        this.projectLifecycle = projectLifecycle;
        this.materialLifecycle = materialLifecycle;
        this.attendanceService = attendanceService;
        this.progressCascade = progressCascade;
        this.settingsService = settingsService;
        this.journal = journal;
        this.runner = runner;
        this.auditService = auditService;
        this.messages = messages;
        this.clock = clock;
    }

    public OperationResult<WorkOrder> createWorkOrder(TenantContext ctx, WorkOrderRequest req) {
        return runner.run(ctx, "createWorkOrder", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.items() == null || req.items().isEmpty())
                throw new WorkshopException("workorder.create.no-items");

            List<ProductionStep> steps = req.productionSteps() != null && !req.productionSteps().isEmpty()
                    ? new ArrayList<>(new LinkedHashSet<>(req.productionSteps()))
                    : settingsService.getProductionSteps(tenantId);

            // One item per product; each item is journaled under its product id
            Set<String> productIds = new TreeSet<>();
            for (WorkOrderRequest.WorkOrderItemRequest item : req.items()) {
                if (item == null || item.productId() == null)
                    throw new WorkshopException("workorder.create.no-items");
                if (!productIds.add(item.productId()))
                    throw new WorkshopException("workorder.create.duplicate-product", item.productId());
            }
            Map<String, Product> products = productRepository.findByTenantIdAndIdIn(tenantId, productIds).stream()
                    .collect(Collectors.toMap(Product::getId, Function.identity()));
            for (String productId : productIds) {
                if (!products.containsKey(productId))
                    throw new ResourceNotFoundException("product", productId);
            }
            Map<String, Project> projects = projectRepository.findByTenantIdAndIdIn(tenantId,
                    products.values().stream().map(Product::getProjectId).collect(Collectors.toSet())).stream()
                    .collect(Collectors.toMap(Project::getId, Function.identity()));

            UnitOfWork uow = journal.begin(ctx, "create-work-order", productIds, req.dueDate(), steps);
            String workOrderId = uow.create("work-order", () -> {
                WorkOrder wo = new WorkOrder();
                wo.setTenantId(tenantId);
                wo.setWorkOrderNumber(NumberGenerator.next(NumberGenerator.WORK_ORDER_PREFIX, LocalDate.now(clock)));
                wo.setStatus(WorkOrderStatus.WAITING);
                wo.setProductionSteps(steps);
                wo.setDueDate(req.dueDate());
                wo.setNotes(req.notes());
                return workOrderRepository.save(wo).getId();
            });

            for (WorkOrderRequest.WorkOrderItemRequest itemReq : req.items()) {
                uow.step("item:" + itemReq.productId(), () -> {
                    Product product = products.get(itemReq.productId());
                    Project project = projects.get(product.getProjectId());
                    WorkOrderItem item = new WorkOrderItem();
                    item.setTenantId(tenantId);
                    item.setWorkOrderId(workOrderId);
                    item.setProductId(product.getId());
                    item.setProductName(product.getName());
                    item.setProjectId(product.getProjectId());
                    item.setProjectName(project != null ? project.getClientName() : null);
                    item.setQuantity(itemReq.quantity() != null ? itemReq.quantity() : product.getQuantity());
                    item.setStatus(WorkOrderItemStatus.WAITING);
                    item.setProcesses(assignments(steps, itemReq.processes()));
                    item.setMaterialCost(product.getMaterialCost());
                    item.setProductValue(itemReq.productValue());
                    item.setPlannedLaborCost(itemReq.plannedLaborCost());
                    itemRepository.save(item);
                });
            }
            uow.complete();

            WorkOrder wo = loadWithItems(tenantId, workOrderId);
            auditService.log(ctx, "WORK_ORDER_CREATED",
                    "Work order: " + wo.getWorkOrderNumber() + ", Items: " + wo.getItems().size());
            return OperationResult.ok(wo, messages.get("workorder.created", wo.getWorkOrderNumber()));
        });
    }

    // One assignment per step, in step order; unknown steps in the request are dropped
    private static List<ProcessAssignment> assignments(List<ProductionStep> steps, List<ProcessAssignment> given) {
        Map<ProductionStep, ProcessAssignment> byStep = new EnumMap<>(ProductionStep.class);
        if (given != null) {
            for (ProcessAssignment a : given) {
                if (a != null && a.getStep() != null)
                    byStep.put(a.getStep(), a);
            }
        }
        List<ProcessAssignment> result = new ArrayList<>();
        for (ProductionStep step : steps) {
            ProcessAssignment a = byStep.getOrDefault(step, new ProcessAssignment());
            a.setStep(step);
            a.setCompleted(false);
            if (a.getHelpers() == null)
                a.setHelpers(new ArrayList<>());
            result.add(a);
        }
        return result;
    }

    /**
     * Starts production. Worker availability and essential materials are
     * checked for every item before anything is written; the first failure
     * aborts the whole start.
     */
    public OperationResult<WorkOrder> startWorkOrder(TenantContext ctx, String workOrderId) {
        return runner.run(ctx, "startWorkOrder", () -> {
            String tenantId = ctx.tenantId();
            WorkOrder wo = findWorkOrder(tenantId, workOrderId);
            WorkOrderStatus next = workOrderLifecycle.fire(wo.getStatus(), WorkOrderEvent.START);

            LocalDate today = LocalDate.now(clock);
            if (wo.getPlannedStartDate() != null && wo.getPlannedStartDate().isAfter(today))
                throw new WorkshopException("workorder.start.before-planned", wo.getPlannedStartDate());

            List<WorkOrderItem> items = itemRepository.findByTenantIdAndWorkOrderId(tenantId, workOrderId);
            if (items.isEmpty())
                throw new WorkshopException("workorder.start.no-items");

            checkWorkers(ctx, items);
            checkEssentialMaterials(tenantId, items);

            for (WorkOrderItem item : items) {
                if (item.getStatus() == WorkOrderItemStatus.WAITING) {
                    item.setStatus(WorkOrderItemStatus.IN_PROGRESS);
                    itemRepository.save(item);
                }
            }

            ProductionStep first = wo.getProductionSteps().isEmpty() ? ProductionStep.CUTTING
                    : wo.getProductionSteps().get(0);
            Set<String> productIds = items.stream().map(WorkOrderItem::getProductId).collect(Collectors.toSet());
            List<Product> products = productRepository.findByTenantIdAndIdIn(tenantId, productIds);
            for (Product product : products) {
                if (productLifecycle.startProduction(product, first))
                    productRepository.save(product);
            }

            Set<String> projectIds = products.stream().map(Product::getProjectId).collect(Collectors.toSet());
            for (Project project : projectRepository.findByTenantIdAndIdIn(tenantId, projectIds)) {
                if (projectLifecycle.onFulfillmentStarted(project, true))
                    projectRepository.save(project);
            }

            if (wo.getStatus() != next) {
                wo.setStatus(next);
                wo.setStartedAt(LocalDateTime.now(clock));
                workOrderRepository.save(wo);
                auditService.log(ctx, "WORK_ORDER_STARTED", "Work order: " + wo.getWorkOrderNumber());
            }
            logger.info("Started work order {} with {} item(s)", wo.getWorkOrderNumber(), items.size());
            wo.setItems(items);
            return OperationResult.ok(wo, messages.get("workorder.started", wo.getWorkOrderNumber()));
        });
    }

    private void checkWorkers(TenantContext ctx, List<WorkOrderItem> items) {
        Map<String, WorkerAvailability> checked = new HashMap<>();
        for (WorkOrderItem item : items) {
            for (ProcessAssignment process : item.getProcesses()) {
                for (WorkerRef worker : process.allWorkers()) {
                    if (worker.getWorkerId() == null)
                        continue;
                    WorkerAvailability availability = checked.computeIfAbsent(worker.getWorkerId(),
                            id -> attendanceService.canWorkerStart(ctx, id));
                    if (!availability.allowed()) {
                        String name = worker.getWorkerName() != null ? worker.getWorkerName() : worker.getWorkerId();
                        throw new WorkshopException("workorder.start.worker-unavailable", name,
                                availability.reason() != null ? availability.reason() : "");
                    }
                }
            }
        }
    }

    private void checkEssentialMaterials(String tenantId, List<WorkOrderItem> items) {
        Map<String, List<ProductMaterial>> byProduct = materialsByProduct(tenantId, items);
        for (WorkOrderItem item : items) {
            List<String> missing = byProduct.getOrDefault(item.getProductId(), List.of()).stream()
                    .filter(m -> m.isEssential() && !materialLifecycle.isEssentialReady(m.getStatus()))
                    .map(ProductMaterial::getMaterialName)
                    .collect(Collectors.toList());
            if (!missing.isEmpty())
                throw new WorkshopException("workorder.start.materials-missing", item.getProductName(),
                        String.join(", ", missing));
        }
    }

    /**
     * Marks a production step of one item as done and moves the product to the
     * next step. The item completes when the product reaches READY, the work
     * order when all items have.
     */
    public OperationResult<WorkOrderItem> completeItemStep(TenantContext ctx, String workOrderId, String itemId,
            ProductionStep step) {
        return runner.run(ctx, "completeWorkOrderItem", () -> {
            String tenantId = ctx.tenantId();
            if (step == null)
                throw new WorkshopException("workorder.step.required");
            WorkOrder wo = findWorkOrder(tenantId, workOrderId);
            if (wo.getStatus() != WorkOrderStatus.IN_PROGRESS && wo.getStatus() != WorkOrderStatus.COMPLETED)
                throw new WorkshopException("workorder.not-started", wo.getWorkOrderNumber());
            List<ProductionStep> steps = wo.getProductionSteps();
            if (!steps.contains(step))
                throw new WorkshopException("workorder.step.unknown", step);

            List<WorkOrderItem> items = itemRepository.findByTenantIdAndWorkOrderId(tenantId, workOrderId);
            WorkOrderItem item = items.stream().filter(i -> i.getId().equals(itemId)).findFirst()
                    .orElseThrow(() -> new ResourceNotFoundException("work order item", itemId));
            Product product = productRepository.findByIdAndTenantId(item.getProductId(), tenantId)
                    .orElseThrow(() -> new ResourceNotFoundException("product", item.getProductId()));

            ProductStatus nextStatus = productLifecycle.nextAfter(step, steps);
            if (productLifecycle.advanceTo(product, nextStatus))
                productRepository.save(product);

            for (ProcessAssignment process : item.getProcesses()) {
                if (process.getStep() == step)
                    process.setCompleted(true);
            }
            if (item.getLastCompletedStep() == null
                    || steps.indexOf(step) > steps.indexOf(item.getLastCompletedStep())) {
                item.setLastCompletedStep(step);
            }
            if (nextStatus == ProductStatus.READY)
                item.setStatus(WorkOrderItemStatus.COMPLETED);
            itemRepository.save(item);

            if (workOrderLifecycle.allItemsCompleted(items)) {
                WorkOrderStatus next = workOrderLifecycle.fire(wo.getStatus(), WorkOrderEvent.COMPLETE);
                if (next != wo.getStatus()) {
                    wo.setStatus(next);
                    wo.setCompletedAt(LocalDateTime.now(clock));
                    workOrderRepository.save(wo);
                    auditService.log(ctx, "WORK_ORDER_COMPLETED", "Work order: " + wo.getWorkOrderNumber());
                }
            }

            progressCascade.syncProject(tenantId, product.getProjectId());
            return OperationResult.ok(item,
                    messages.get("workorder.step-completed", step, item.getProductName(), nextStatus));
        });
    }

    /**
     * Plans the work order without starting it. Every essential material that
     * is not ready yet gets an urgent procurement task due at the planned start.
     */
    public OperationResult<ScheduleResult> scheduleWorkOrder(TenantContext ctx, String workOrderId,
            ScheduleRequest req) {
        return runner.run(ctx, "scheduleWorkOrder", () -> {
            String tenantId = ctx.tenantId();
            if (req == null || req.plannedStartDate() == null)
                throw new WorkshopException("workorder.schedule.start-required");
            if (req.plannedEndDate() != null && req.plannedEndDate().isBefore(req.plannedStartDate()))
                throw new WorkshopException("workorder.schedule.invalid-dates");

            WorkOrder wo = findWorkOrder(tenantId, workOrderId);
            WorkOrderStatus next = workOrderLifecycle.fire(wo.getStatus(), WorkOrderEvent.SCHEDULE);
            wo.setStatus(next);
            wo.setPlannedStartDate(req.plannedStartDate());
            wo.setPlannedEndDate(req.plannedEndDate());
            wo.setScheduledAt(LocalDateTime.now(clock));
            workOrderRepository.save(wo);

            List<WorkOrderItem> items = itemRepository.findByTenantIdAndWorkOrderId(tenantId, workOrderId);
            int created = createProcurementTasks(tenantId, wo, items);
            List<WorkerConflict> conflicts = findWorkerConflicts(tenantId, wo, items);
            if (!conflicts.isEmpty())
                logger.info("Work order {} overlaps with {} booking(s)", wo.getWorkOrderNumber(), conflicts.size());

            auditService.log(ctx, "WORK_ORDER_SCHEDULED", "Work order: " + wo.getWorkOrderNumber() + ", "
                    + req.plannedStartDate() + " - " + req.plannedEndDate());
            wo.setItems(items);
            return OperationResult.ok(new ScheduleResult(wo, created, conflicts),
                    messages.get("workorder.scheduled", wo.getWorkOrderNumber(), req.plannedStartDate(), created));
        });
    }

    private int createProcurementTasks(String tenantId, WorkOrder wo, List<WorkOrderItem> items) {
        Map<String, List<ProductMaterial>> byProduct = materialsByProduct(tenantId, items);
        int created = 0;
        for (WorkOrderItem item : items) {
            for (ProductMaterial m : byProduct.getOrDefault(item.getProductId(), List.of())) {
                if (!m.isEssential() || materialLifecycle.isEssentialReady(m.getStatus()))
                    continue;
                // An open task from an earlier scheduling is enough
                if (taskRepository.existsByTenantIdAndRelatedWorkOrderIdAndRelatedMaterialIdAndStatusNot(tenantId,
                        wo.getId(), m.getId(), TaskStatus.DONE))
                    continue;
                Task task = new Task();
                task.setTenantId(tenantId);
                task.setProjectId(item.getProjectId());
                task.setProductId(item.getProductId());
                task.setTitle(messages.get("task.procure.title", m.getMaterialName()));
                task.setDescription(messages.get("task.procure.description", m.getMaterialName(),
                        item.getProductName(), wo.getWorkOrderNumber()));
                task.setPriority(TaskPriority.URGENT);
                task.setStatus(TaskStatus.OPEN);
                task.setDueDate(wo.getPlannedStartDate());
                task.setAutoGenerated(true);
                task.setRelatedWorkOrderId(wo.getId());
                task.setRelatedMaterialId(m.getId());
                taskRepository.save(task);
                created++;
            }
        }
        return created;
    }

    /**
     * Workers of this work order that are already booked on another scheduled
     * or running work order whose planned period overlaps.
     */
    List<WorkerConflict> findWorkerConflicts(String tenantId, WorkOrder wo, List<WorkOrderItem> items) {
        Set<String> ourWorkers = workerIds(items);
        if (ourWorkers.isEmpty() || wo.getPlannedStartDate() == null)
            return List.of();

        List<WorkOrder> others = workOrderRepository.findByTenantIdAndStatusIn(tenantId, BOOKED).stream()
                .filter(o -> !o.getId().equals(wo.getId()) && overlaps(wo, o))
                .collect(Collectors.toList());
        if (others.isEmpty())
            return List.of();

        Map<String, List<WorkOrderItem>> otherItems = itemRepository.findByTenantIdAndWorkOrderIdIn(tenantId,
                others.stream().map(WorkOrder::getId).collect(Collectors.toList())).stream()
                .collect(Collectors.groupingBy(WorkOrderItem::getWorkOrderId));

        List<WorkerConflict> conflicts = new ArrayList<>();
        for (WorkOrder other : others) {
            Map<String, String> names = new LinkedHashMap<>();
            for (WorkOrderItem i : otherItems.getOrDefault(other.getId(), List.of())) {
                for (ProcessAssignment p : i.getProcesses()) {
                    for (WorkerRef w : p.allWorkers()) {
                        if (w.getWorkerId() != null && ourWorkers.contains(w.getWorkerId()))
                            names.putIfAbsent(w.getWorkerId(), w.getWorkerName());
                    }
                }
            }
            names.forEach((id, name) -> conflicts
                    .add(new WorkerConflict(id, name, other.getId(), other.getWorkOrderNumber())));
        }
        return conflicts;
    }

    private static boolean overlaps(WorkOrder a, WorkOrder b) {
        if (b.getPlannedStartDate() == null)
            return false;
        LocalDate aEnd = a.getPlannedEndDate() != null ? a.getPlannedEndDate() : a.getPlannedStartDate();
        LocalDate bEnd = b.getPlannedEndDate() != null ? b.getPlannedEndDate() : b.getPlannedStartDate();
        return !a.getPlannedStartDate().isAfter(bEnd) && !b.getPlannedStartDate().isAfter(aEnd);
    }

    private static Set<String> workerIds(List<WorkOrderItem> items) {
        Set<String> ids = new HashSet<>();
        for (WorkOrderItem i : items) {
            for (ProcessAssignment p : i.getProcesses()) {
                for (WorkerRef w : p.allWorkers()) {
                    if (w.getWorkerId() != null)
                        ids.add(w.getWorkerId());
                }
            }
        }
        return ids;
    }

    public OperationResult<WorkOrder> unscheduleWorkOrder(TenantContext ctx, String workOrderId) {
        return runner.run(ctx, "unscheduleWorkOrder", () -> {
            WorkOrder wo = findWorkOrder(ctx.tenantId(), workOrderId);
            if (wo.getStatus() == WorkOrderStatus.IN_PROGRESS)
                throw new WorkshopException("workorder.unschedule.in-progress", wo.getWorkOrderNumber());
            WorkOrderStatus next = workOrderLifecycle.fire(wo.getStatus(), WorkOrderEvent.UNSCHEDULE);
            wo.setStatus(next);
            wo.setPlannedStartDate(null);
            wo.setPlannedEndDate(null);
            wo.setScheduledAt(null);
            workOrderRepository.save(wo);
            auditService.log(ctx, "WORK_ORDER_UNSCHEDULED", "Work order: " + wo.getWorkOrderNumber());
            return OperationResult.ok(wo, messages.get("workorder.unscheduled", wo.getWorkOrderNumber()));
        });
    }

    /**
     * Deletes a work order and its items after moving their products according
     * to {@code disposal}.
     */
    public OperationResult<Void> deleteWorkOrder(TenantContext ctx, String workOrderId, ProductDisposal disposal) {
        return runner.run(ctx, "deleteWorkOrder", () -> {
            String tenantId = ctx.tenantId();
            if (disposal == null)
                throw new WorkshopException("workorder.delete.disposal-required");
            WorkOrder wo = findWorkOrder(tenantId, workOrderId);
            List<WorkOrderItem> items = itemRepository.findByTenantIdAndWorkOrderId(tenantId, workOrderId);

            Set<String> productIds = items.stream().map(WorkOrderItem::getProductId).collect(Collectors.toSet());
            Set<String> projectIds = new HashSet<>();
            for (Product product : productRepository.findByTenantIdAndIdIn(tenantId, productIds)) {
                if (productLifecycle.dispose(product, disposal))
                    productRepository.save(product);
                projectIds.add(product.getProjectId());
            }
            itemRepository.deleteAll(items);
            workOrderRepository.delete(wo);
            projectIds.forEach(projectId -> progressCascade.syncProject(tenantId, projectId));

            auditService.log(ctx, "WORK_ORDER_DELETED",
                    "Work order: " + wo.getWorkOrderNumber() + ", Products: " + disposal);
            return OperationResult.ok(null, messages.get("workorder.deleted", wo.getWorkOrderNumber()));
        });
    }

    public OperationResult<WorkOrder> getWorkOrder(TenantContext ctx, String workOrderId) {
        return runner.run(ctx, "getWorkOrder",
                () -> OperationResult.ok(loadWithItems(ctx.tenantId(), workOrderId), ""));
    }

    private WorkOrder findWorkOrder(String tenantId, String workOrderId) {
        return workOrderRepository.findByIdAndTenantId(workOrderId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("work order", workOrderId));
    }

    private WorkOrder loadWithItems(String tenantId, String workOrderId) {
        WorkOrder wo = findWorkOrder(tenantId, workOrderId);
        wo.setItems(itemRepository.findByTenantIdAndWorkOrderId(tenantId, workOrderId));
        return wo;
    }

    private Map<String, List<ProductMaterial>> materialsByProduct(String tenantId, List<WorkOrderItem> items) {
        Set<String> productIds = items.stream().map(WorkOrderItem::getProductId).collect(Collectors.toSet());
        if (productIds.isEmpty())
            return Map.of();
        return materialRepository.findByTenantIdAndProductIdIn(tenantId, productIds).stream()
                .collect(Collectors.groupingBy(ProductMaterial::getProductId));
    }
}

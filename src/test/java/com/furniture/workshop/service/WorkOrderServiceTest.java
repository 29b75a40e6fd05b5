package com.furniture.workshop.service;

import com.furniture.workshop.dto.OperationResult;
import com.furniture.workshop.dto.ScheduleRequest;
import com.furniture.workshop.dto.ScheduleResult;
import com.furniture.workshop.dto.TenantContext;
import com.furniture.workshop.dto.WorkerAvailability;
import com.furniture.workshop.dto.WorkerConflict;
import com.furniture.workshop.lifecycle.MaterialLifecycle;
import com.furniture.workshop.lifecycle.ProductLifecycle;
import com.furniture.workshop.lifecycle.ProjectLifecycle;
import com.furniture.workshop.lifecycle.WorkOrderLifecycle;
import com.furniture.workshop.model.*;
import com.furniture.workshop.repository.*;
import com.furniture.workshop.util.Messages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class WorkOrderServiceTest {

    private static final TenantContext CTX = new TenantContext("t1", "marko");
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 6);

    @Mock
    private WorkOrderRepository workOrderRepository;

    @Mock
    private WorkOrderItemRepository itemRepository;

    @Mock
    private ProductRepository productRepository;

    @Mock
    private ProductMaterialRepository materialRepository;

    @Mock
    private ProjectRepository projectRepository;

    @Mock
    private TaskRepository taskRepository;

    @Mock
    private AttendanceService attendanceService;

    @Mock
    private ProgressCascade progressCascade;

    @Mock
    private SettingsService settingsService;

    @Mock
    private CascadeJournal journal;

    @Mock
    private AuditService auditService;

    @Mock
    private Messages messages;

    private WorkOrderService workOrderService;

    private WorkOrder workOrder;
    private WorkOrderItem item;
    private Product product;
    private Project project;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        Clock clock = Clock.fixed(TODAY.atStartOfDay().toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        MaterialLifecycle materialLifecycle = new MaterialLifecycle();
        workOrderService = new WorkOrderService(workOrderRepository, itemRepository, productRepository,
                materialRepository, projectRepository, taskRepository, new WorkOrderLifecycle(),
                new ProductLifecycle(materialLifecycle), new ProjectLifecycle(), materialLifecycle,
                attendanceService, progressCascade, settingsService, journal, new OperationRunner(messages),
                auditService, messages, clock);

        workOrder = new WorkOrder();
        workOrder.setId("wo1");
        workOrder.setWorkOrderNumber("RN-20240506-0001");
        workOrder.setStatus(WorkOrderStatus.WAITING);
        workOrder.setProductionSteps(new ArrayList<>(List.of(ProductionStep.CUTTING, ProductionStep.ASSEMBLY)));

        item = new WorkOrderItem();
        item.setId("i1");
        item.setWorkOrderId("wo1");
        item.setProductId("p1");
        item.setProductName("Wardrobe");
        item.setProjectId("pr1");
        item.setStatus(WorkOrderItemStatus.WAITING);
        item.setProcesses(new ArrayList<>(List.of(assignment(ProductionStep.CUTTING, "w1", "Ivan"),
                assignment(ProductionStep.ASSEMBLY, "w2", "Ana"))));

        product = new Product();
        product.setId("p1");
        product.setProjectId("pr1");
        product.setStatus(ProductStatus.MATERIALS_READY);

        project = new Project();
        project.setId("pr1");
        project.setStatus(ProjectStatus.APPROVED);

        when(workOrderRepository.findByIdAndTenantId("wo1", "t1")).thenReturn(Optional.of(workOrder));
        when(itemRepository.findByTenantIdAndWorkOrderId("t1", "wo1")).thenReturn(List.of(item));
        when(productRepository.findByTenantIdAndIdIn(eq("t1"), anyCollection())).thenReturn(List.of(product));
        when(productRepository.findByIdAndTenantId("p1", "t1")).thenReturn(Optional.of(product));
        when(projectRepository.findByTenantIdAndIdIn(eq("t1"), anyCollection())).thenReturn(List.of(project));
        when(attendanceService.canWorkerStart(any(TenantContext.class), anyString()))
                .thenReturn(WorkerAvailability.available());
    }

    private static ProcessAssignment assignment(ProductionStep step, String workerId, String workerName) {
        ProcessAssignment a = new ProcessAssignment();
        a.setStep(step);
        a.setWorker(new WorkerRef(workerId, workerName));
        return a;
    }

    private static ProductMaterial essential(MaterialStatus status) {
        ProductMaterial m = new ProductMaterial();
        m.setId("m1");
        m.setProductId("p1");
        m.setMaterialName("Hinges");
        m.setEssential(true);
        m.setStatus(status);
        m.setQuantity(BigDecimal.ONE);
        return m;
    }

    @Test
    void startWorkOrder_unavailableWorkerWritesNothing() {
        when(attendanceService.canWorkerStart(CTX, "w2")).thenReturn(WorkerAvailability.unavailable("Sick leave"));

        OperationResult<WorkOrder> result = workOrderService.startWorkOrder(CTX, "wo1");

        assertFalse(result.success());
        verify(itemRepository, never()).save(any(WorkOrderItem.class));
        verify(productRepository, never()).save(any(Product.class));
        verify(projectRepository, never()).save(any(Project.class));
        verify(workOrderRepository, never()).save(any(WorkOrder.class));
        assertEquals(WorkOrderStatus.WAITING, workOrder.getStatus());
    }

    @Test
    void startWorkOrder_missingEssentialMaterialWritesNothing() {
        when(materialRepository.findByTenantIdAndProductIdIn(eq("t1"), anyCollection()))
                .thenReturn(List.of(essential(MaterialStatus.ORDERED)));

        OperationResult<WorkOrder> result = workOrderService.startWorkOrder(CTX, "wo1");

        assertFalse(result.success());
        verify(itemRepository, never()).save(any(WorkOrderItem.class));
        verify(workOrderRepository, never()).save(any(WorkOrder.class));
    }

    @Test
    void startWorkOrder_movesProductAndProjectIntoProduction() {
        when(materialRepository.findByTenantIdAndProductIdIn(eq("t1"), anyCollection()))
                .thenReturn(List.of(essential(MaterialStatus.ON_STOCK)));

        OperationResult<WorkOrder> result = workOrderService.startWorkOrder(CTX, "wo1");

        assertTrue(result.success());
        assertEquals(WorkOrderStatus.IN_PROGRESS, workOrder.getStatus());
        assertNotNull(workOrder.getStartedAt());
        assertEquals(WorkOrderItemStatus.IN_PROGRESS, item.getStatus());
        assertEquals(ProductStatus.CUTTING, product.getStatus());
        assertEquals(ProjectStatus.IN_PRODUCTION, project.getStatus());
    }

    @Test
    void startWorkOrder_refusesBeforePlannedStart() {
        workOrder.setStatus(WorkOrderStatus.SCHEDULED);
        workOrder.setPlannedStartDate(TODAY.plusDays(3));

        OperationResult<WorkOrder> result = workOrderService.startWorkOrder(CTX, "wo1");

        assertFalse(result.success());
        verify(workOrderRepository, never()).save(any(WorkOrder.class));
    }

    @Test
    void completeItemStep_lastStepCompletesItemAndWorkOrder() {
        workOrder.setStatus(WorkOrderStatus.IN_PROGRESS);
        item.setStatus(WorkOrderItemStatus.IN_PROGRESS);
        product.setStatus(ProductStatus.ASSEMBLY);

        OperationResult<WorkOrderItem> result = workOrderService.completeItemStep(CTX, "wo1", "i1",
                ProductionStep.ASSEMBLY);

        assertTrue(result.success());
        assertEquals(ProductStatus.READY, product.getStatus());
        assertEquals(WorkOrderItemStatus.COMPLETED, item.getStatus());
        assertEquals(ProductionStep.ASSEMBLY, item.getLastCompletedStep());
        assertEquals(WorkOrderStatus.COMPLETED, workOrder.getStatus());
        verify(progressCascade).syncProject("t1", "pr1");
    }

    @Test
    void completeItemStep_earlierStepNeverMovesProductBack() {
        workOrder.setStatus(WorkOrderStatus.IN_PROGRESS);
        item.setStatus(WorkOrderItemStatus.IN_PROGRESS);
        product.setStatus(ProductStatus.READY);

        OperationResult<WorkOrderItem> result = workOrderService.completeItemStep(CTX, "wo1", "i1",
                ProductionStep.CUTTING);

        assertTrue(result.success());
        assertEquals(ProductStatus.READY, product.getStatus());
        verify(productRepository, never()).save(any(Product.class));
    }

    @Test
    void completeItemStep_requiresStartedWorkOrder() {
        OperationResult<WorkOrderItem> result = workOrderService.completeItemStep(CTX, "wo1", "i1",
                ProductionStep.CUTTING);

        assertFalse(result.success());
        verify(itemRepository, never()).save(any(WorkOrderItem.class));
    }

    @Test
    void scheduleWorkOrder_createsUrgentTaskForMissingEssentialMaterial() {
        when(materialRepository.findByTenantIdAndProductIdIn(eq("t1"), anyCollection()))
                .thenReturn(List.of(essential(MaterialStatus.NOT_ORDERED)));

        OperationResult<ScheduleResult> result = workOrderService.scheduleWorkOrder(CTX, "wo1",
                new ScheduleRequest(TODAY.plusDays(2), TODAY.plusDays(4)));

        assertTrue(result.success());
        assertEquals(1, result.data().tasksCreated());
        assertEquals(WorkOrderStatus.SCHEDULED, workOrder.getStatus());
        ArgumentCaptor<Task> task = ArgumentCaptor.forClass(Task.class);
        verify(taskRepository).save(task.capture());
        assertEquals(TaskPriority.URGENT, task.getValue().getPriority());
        assertEquals(TODAY.plusDays(2), task.getValue().getDueDate());
        assertEquals("m1", task.getValue().getRelatedMaterialId());
    }

    @Test
    void scheduleWorkOrder_skipsMaterialWithOpenTask() {
        when(materialRepository.findByTenantIdAndProductIdIn(eq("t1"), anyCollection()))
                .thenReturn(List.of(essential(MaterialStatus.NOT_ORDERED)));
        when(taskRepository.existsByTenantIdAndRelatedWorkOrderIdAndRelatedMaterialIdAndStatusNot("t1", "wo1", "m1",
                TaskStatus.DONE)).thenReturn(true);

        OperationResult<ScheduleResult> result = workOrderService.scheduleWorkOrder(CTX, "wo1",
                new ScheduleRequest(TODAY.plusDays(2), null));

        assertTrue(result.success());
        assertEquals(0, result.data().tasksCreated());
        verify(taskRepository, never()).save(any(Task.class));
    }

    @Test
    void scheduleWorkOrder_rejectsEndBeforeStart() {
        OperationResult<ScheduleResult> result = workOrderService.scheduleWorkOrder(CTX, "wo1",
                new ScheduleRequest(TODAY.plusDays(4), TODAY.plusDays(2)));

        assertFalse(result.success());
        verify(workOrderRepository, never()).save(any(WorkOrder.class));
    }

    @Test
    void findWorkerConflicts_reportsOverlappingBookings() {
        workOrder.setPlannedStartDate(TODAY);
        workOrder.setPlannedEndDate(TODAY.plusDays(2));

        WorkOrder other = new WorkOrder();
        other.setId("wo2");
        other.setWorkOrderNumber("RN-20240501-0001");
        other.setStatus(WorkOrderStatus.SCHEDULED);
        other.setPlannedStartDate(TODAY.plusDays(1));
        WorkOrder later = new WorkOrder();
        later.setId("wo3");
        later.setStatus(WorkOrderStatus.SCHEDULED);
        later.setPlannedStartDate(TODAY.plusDays(10));
        when(workOrderRepository.findByTenantIdAndStatusIn(eq("t1"), anyCollection()))
                .thenReturn(List.of(workOrder, other, later));

        WorkOrderItem otherItem = new WorkOrderItem();
        otherItem.setWorkOrderId("wo2");
        otherItem.setProcesses(new ArrayList<>(List.of(assignment(ProductionStep.EDGING, "w1", "Ivan"))));
        when(itemRepository.findByTenantIdAndWorkOrderIdIn(eq("t1"), anyCollection())).thenReturn(List.of(otherItem));

        List<WorkerConflict> conflicts = workOrderService.findWorkerConflicts("t1", workOrder, List.of(item));

        assertEquals(1, conflicts.size());
        assertEquals("w1", conflicts.get(0).workerId());
        assertEquals("wo2", conflicts.get(0).workOrderId());
    }
}

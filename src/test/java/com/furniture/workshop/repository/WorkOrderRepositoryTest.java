package com.furniture.workshop.repository;

import com.furniture.workshop.model.ProductionStep;
import com.furniture.workshop.model.WorkLog;
import com.furniture.workshop.model.WorkOrder;
import com.furniture.workshop.model.WorkOrderStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class WorkOrderRepositoryTest {

    @Autowired
    private WorkOrderRepository workOrderRepository;

    @Autowired
    private WorkLogRepository workLogRepository;

    @Test
    void findByStatusIn_returnsOnlyActiveOrdersOfTenant() {
        workOrder("t1", "WO-1", WorkOrderStatus.SCHEDULED);
        workOrder("t1", "WO-2", WorkOrderStatus.IN_PROGRESS);
        workOrder("t1", "WO-3", WorkOrderStatus.COMPLETED);
        workOrder("t2", "WO-4", WorkOrderStatus.SCHEDULED);

        List<WorkOrder> active = workOrderRepository.findByTenantIdAndStatusIn("t1",
                EnumSet.of(WorkOrderStatus.SCHEDULED, WorkOrderStatus.IN_PROGRESS));

        assertEquals(2, active.size());
        assertTrue(active.stream().noneMatch(w -> w.getStatus() == WorkOrderStatus.COMPLETED));
    }

    @Test
    void productionSteps_keepTheirOrder() {
        WorkOrder wo = new WorkOrder();
        wo.setTenantId("t1");
        wo.setWorkOrderNumber("WO-9");
        wo.setProductionSteps(List.of(ProductionStep.CUTTING, ProductionStep.EDGING, ProductionStep.ASSEMBLY));
        String id = workOrderRepository.save(wo).getId();

        WorkOrder loaded = workOrderRepository.findByIdAndTenantId(id, "t1").orElseThrow();

        assertEquals(WorkOrderStatus.WAITING, loaded.getStatus());
        assertEquals(List.of(ProductionStep.CUTTING, ProductionStep.EDGING, ProductionStep.ASSEMBLY),
                loaded.getProductionSteps());
    }

    @Test
    void workLogExists_matchesWorkerItemAndDay() {
        WorkLog log = new WorkLog();
        log.setTenantId("t1");
        log.setWorkerId("w1");
        log.setWorkOrderId("wo1");
        log.setWorkOrderItemId("i1");
        log.setWorkDate(LocalDate.of(2024, 5, 6));
        log.setDailyRate(new BigDecimal("120"));
        workLogRepository.save(log);

        assertTrue(workLogRepository.existsByTenantIdAndWorkerIdAndWorkOrderItemIdAndWorkDate("t1", "w1", "i1",
                LocalDate.of(2024, 5, 6)));
        assertFalse(workLogRepository.existsByTenantIdAndWorkerIdAndWorkOrderItemIdAndWorkDate("t1", "w1", "i1",
                LocalDate.of(2024, 5, 7)));
        assertFalse(workLogRepository.existsByTenantIdAndWorkerIdAndWorkOrderItemIdAndWorkDate("t2", "w1", "i1",
                LocalDate.of(2024, 5, 6)));
    }

    private void workOrder(String tenantId, String number, WorkOrderStatus status) {
        WorkOrder wo = new WorkOrder();
        wo.setTenantId(tenantId);
        wo.setWorkOrderNumber(number);
        wo.setStatus(status);
        workOrderRepository.save(wo);
    }
}

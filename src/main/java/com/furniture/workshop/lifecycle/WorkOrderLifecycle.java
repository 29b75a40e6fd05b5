package com.furniture.workshop.lifecycle;

import com.furniture.workshop.model.WorkOrderItem;
import com.furniture.workshop.model.WorkOrderItemStatus;
import com.furniture.workshop.model.WorkOrderStatus;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.furniture.workshop.model.WorkOrderStatus.*;

@Component
public class WorkOrderLifecycle {

    private static final TransitionTable<WorkOrderStatus, WorkOrderEvent> TABLE = TransitionTable
            .builder("work order", WorkOrderStatus.class, WorkOrderEvent.class)
            .allow(WAITING, WorkOrderEvent.SCHEDULE, SCHEDULED)
            .allow(SCHEDULED, WorkOrderEvent.UNSCHEDULE, WAITING)
            .allow(WAITING, WorkOrderEvent.START, IN_PROGRESS)
            .allow(SCHEDULED, WorkOrderEvent.START, IN_PROGRESS)
            .allow(IN_PROGRESS, WorkOrderEvent.COMPLETE, COMPLETED)
            .build();

    public WorkOrderStatus fire(WorkOrderStatus current, WorkOrderEvent event) {
        return TABLE.fire(current, event);
    }

    public boolean canFire(WorkOrderStatus current, WorkOrderEvent event) {
        return TABLE.canFire(current, event);
    }

    public boolean allItemsCompleted(List<WorkOrderItem> items) {
        return !items.isEmpty() && items.stream().allMatch(i -> i.getStatus() == WorkOrderItemStatus.COMPLETED);
    }
}

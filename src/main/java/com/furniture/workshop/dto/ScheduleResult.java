package com.furniture.workshop.dto;

import com.furniture.workshop.model.WorkOrder;

import java.util.List;

public record ScheduleResult(WorkOrder workOrder, int tasksCreated, List<WorkerConflict> conflicts) {
}

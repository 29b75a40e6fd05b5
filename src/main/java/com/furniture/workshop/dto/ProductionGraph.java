package com.furniture.workshop.dto;

import com.furniture.workshop.model.*;
import lombok.Builder;
import lombok.Getter;

import java.util.List;
import java.util.Optional;

/**
 * Denormalized snapshot of one tenant's data with children attached to their
 * parents. {@code loaded == false} means the snapshot could not be read, not
 * that the tenant has no data.
 */
@Getter
@Builder
public class ProductionGraph {

    private final boolean loaded;

    @Builder.Default
    private final List<Project> projects = List.of();
    @Builder.Default
    private final List<PurchaseOrder> orders = List.of();
    @Builder.Default
    private final List<WorkOrder> workOrders = List.of();
    @Builder.Default
    private final List<Supplier> suppliers = List.of();
    @Builder.Default
    private final List<Worker> workers = List.of();
    @Builder.Default
    private final List<Task> tasks = List.of();
    @Builder.Default
    private final List<WorkLog> workLogs = List.of();

    public static ProductionGraph empty() {
        return ProductionGraph.builder().loaded(false).build();
    }

    public Optional<Project> findProject(String projectId) {
        return projects.stream().filter(p -> p.getId().equals(projectId)).findFirst();
    }

    public Optional<PurchaseOrder> findOrder(String orderId) {
        return orders.stream().filter(o -> o.getId().equals(orderId)).findFirst();
    }

    public Optional<WorkOrder> findWorkOrder(String workOrderId) {
        return workOrders.stream().filter(w -> w.getId().equals(workOrderId)).findFirst();
    }
}

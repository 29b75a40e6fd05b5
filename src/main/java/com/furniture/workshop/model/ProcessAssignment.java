package com.furniture.workshop.model;

import lombok.Data;
import java.util.ArrayList;
import java.util.List;

/** Who works on one production step of a work order item. */
@Data
public class ProcessAssignment {
    private ProductionStep step;
    private WorkerRef worker;
    private List<WorkerRef> helpers = new ArrayList<>();
    private boolean completed;

    public List<WorkerRef> allWorkers() {
        List<WorkerRef> all = new ArrayList<>();
        if (worker != null && worker.getWorkerId() != null)
            all.add(worker);
        if (helpers != null)
            all.addAll(helpers);
        return all;
    }
}

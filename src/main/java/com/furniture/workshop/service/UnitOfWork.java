package com.furniture.workshop.service;

import com.furniture.workshop.model.CascadeStep;
import com.furniture.workshop.repository.CascadeStepRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Records which steps of one cascade already committed. Re-running the same
 * cascade after a failure skips them; {@link #complete()} forgets the run.
 */
public class UnitOfWork {

    private static final Logger logger = LoggerFactory.getLogger(UnitOfWork.class);

    private final CascadeStepRepository repository;
    private final String tenantId;
    private final String cascadeKey;
    private final Map<String, CascadeStep> applied;

    UnitOfWork(CascadeStepRepository repository, String tenantId, String cascadeKey,
            Map<String, CascadeStep> applied) {
        this.repository = repository;
        this.tenantId = tenantId;
        this.cascadeKey = cascadeKey;
        this.applied = applied;
    }

    public void step(String name, Runnable action) {
        create(name, () -> {
            action.run();
            return null;
        });
    }

    /** Runs a step that creates a record and returns its id, recorded for retries. */
    public String create(String name, Supplier<String> action) {
        CascadeStep done = applied.get(name);
        if (done != null) {
            logger.debug("Skipping step {} of {} (applied {})", name, cascadeKey, done.getAppliedAt());
            return done.getResultRef();
        }
        String ref = action.get();
        CascadeStep step = new CascadeStep();
        step.setTenantId(tenantId);
        step.setCascadeKey(cascadeKey);
        step.setStepName(name);
        step.setResultRef(ref);
        applied.put(name, repository.save(step));
        return ref;
    }

    /** Result recorded by an already applied step, or {@code null}. */
    public String recorded(String name) {
        CascadeStep done = applied.get(name);
        return done != null ? done.getResultRef() : null;
    }

    public boolean isResumed() {
        return !applied.isEmpty();
    }

    public void complete() {
        repository.deleteAll(new ArrayList<>(applied.values()));
        applied.clear();
    }
}

package com.furniture.workshop.model;

import java.util.Map;
import java.util.Set;

/** Project lifecycle status with validated transitions. */
public enum ProjectStatus {
    DRAFT,
    OFFERED,
    APPROVED,
    IN_PRODUCTION,
    ASSEMBLY,
    INSTALLATION,
    COMPLETED,
    CANCELLED;

    private static final Map<ProjectStatus, Set<ProjectStatus>> ALLOWED_TRANSITIONS = Map.of(
            DRAFT, Set.of(OFFERED, APPROVED, IN_PRODUCTION, CANCELLED),
            OFFERED, Set.of(DRAFT, APPROVED, CANCELLED),
            APPROVED, Set.of(IN_PRODUCTION, COMPLETED, CANCELLED),
            IN_PRODUCTION, Set.of(ASSEMBLY, INSTALLATION, COMPLETED),
            ASSEMBLY, Set.of(INSTALLATION, COMPLETED),
            INSTALLATION, Set.of(COMPLETED),
            COMPLETED, Set.of(),
            CANCELLED, Set.of(DRAFT));

    public Set<ProjectStatus> allowedTransitions() {
        return ALLOWED_TRANSITIONS.getOrDefault(this, Set.of());
    }

    /** Same-status moves are accepted as no-ops. */
    public boolean canTransitionTo(ProjectStatus target) {
        return this == target || allowedTransitions().contains(target);
    }
}

package com.furniture.workshop.model;

import java.util.Map;
import java.util.Set;

public enum OfferStatus {
    DRAFT,
    SENT,
    ACCEPTED,
    REJECTED,
    EXPIRED,
    SUPERSEDED;

    private static final Map<OfferStatus, Set<OfferStatus>> ALLOWED_TRANSITIONS = Map.of(
            DRAFT, Set.of(SENT, ACCEPTED, REJECTED, SUPERSEDED),
            SENT, Set.of(DRAFT, ACCEPTED, REJECTED, EXPIRED, SUPERSEDED),
            ACCEPTED, Set.of(),
            REJECTED, Set.of(),
            EXPIRED, Set.of(SENT),
            SUPERSEDED, Set.of());

    public boolean canTransitionTo(OfferStatus target) {
        return this == target || ALLOWED_TRANSITIONS.getOrDefault(this, Set.of()).contains(target);
    }

    /** Rejected, expired and superseded offers can no longer approve their project. */
    public boolean isClosedNegative() {
        return this == REJECTED || this == EXPIRED || this == SUPERSEDED;
    }

    public boolean isOpen() {
        return this == DRAFT || this == SENT;
    }
}

package com.furniture.workshop.lifecycle;

import com.furniture.workshop.exception.IllegalTransitionException;
import com.furniture.workshop.model.Offer;
import com.furniture.workshop.model.OfferStatus;
import com.furniture.workshop.model.Product;
import com.furniture.workshop.model.Project;
import com.furniture.workshop.model.ProjectStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Project status is derived from its offers and products. Each rule here
 * returns whether the project changed; none of them reads the store.
 */
@Component
public class ProjectLifecycle {

    public boolean onOfferSent(Project project) {
        return project.getStatus() == ProjectStatus.DRAFT && move(project, ProjectStatus.OFFERED);
    }

    public boolean onOfferAccepted(Project project) {
        ProjectStatus s = project.getStatus();
        if (s != ProjectStatus.DRAFT && s != ProjectStatus.OFFERED)
            return false;
        return move(project, ProjectStatus.APPROVED);
    }

    /**
     * Fulfilment started (order sent or work order started). Work order starts
     * also lift projects that skipped the offer round.
     */
    public boolean onFulfillmentStarted(Project project, boolean includeDraft) {
        ProjectStatus s = project.getStatus();
        if (s == ProjectStatus.APPROVED || (includeDraft && s == ProjectStatus.DRAFT))
            return move(project, ProjectStatus.IN_PRODUCTION);
        return false;
    }

    /**
     * Cancels a project that never got past the offer round once all of its
     * offers are closed.
     *
     * @param siblings       every offer of the project as last read
     * @param changedOfferId the offer whose status is being changed
     * @param newStatus      its new status, not yet persisted
     */
    public boolean onOfferClosed(Project project, List<Offer> siblings, String changedOfferId, OfferStatus newStatus) {
        ProjectStatus s = project.getStatus();
        if (s != ProjectStatus.OFFERED && s != ProjectStatus.DRAFT)
            return false;
        if (!allOffersClosed(siblings, changedOfferId, newStatus))
            return false;
        return move(project, ProjectStatus.CANCELLED);
    }

    public static boolean allOffersClosed(List<Offer> siblings, String changedOfferId, OfferStatus newStatus) {
        if (!newStatus.isClosedNegative())
            return false;
        return siblings.stream()
                .map(o -> o.getId().equals(changedOfferId) ? newStatus : o.getStatus())
                .allMatch(OfferStatus::isClosedNegative);
    }

    /** Re-derives the project from its products after a production step. */
    public boolean sync(Project project, List<Product> products) {
        ProjectStatus s = project.getStatus();
        if (s == ProjectStatus.DRAFT || s == ProjectStatus.OFFERED || s == ProjectStatus.CANCELLED
                || s == ProjectStatus.COMPLETED)
            return false;
        if (products.isEmpty())
            return false;
        if (products.stream().allMatch(p -> p.getStatus().isFinished()))
            return move(project, ProjectStatus.COMPLETED);
        if (s == ProjectStatus.APPROVED && products.stream().anyMatch(p -> p.getStatus().isInProduction()))
            return move(project, ProjectStatus.IN_PRODUCTION);
        return false;
    }

    /** Explicit status change requested by a user. */
    public boolean changeStatus(Project project, ProjectStatus target) {
        return move(project, target);
    }

    private boolean move(Project project, ProjectStatus target) {
        ProjectStatus current = project.getStatus();
        if (!current.canTransitionTo(target))
            throw new IllegalTransitionException("project", current, target);
        if (current == target)
            return false;
        project.setStatus(target);
        return true;
    }
}

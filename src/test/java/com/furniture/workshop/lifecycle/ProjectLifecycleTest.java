package com.furniture.workshop.lifecycle;

import com.furniture.workshop.exception.IllegalTransitionException;
import com.furniture.workshop.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectLifecycleTest {

    private final ProjectLifecycle lifecycle = new ProjectLifecycle();

    private static Project project(ProjectStatus status) {
        Project p = new Project();
        p.setId("p1");
        p.setStatus(status);
        return p;
    }

    private static Offer offer(String id, OfferStatus status) {
        Offer o = new Offer();
        o.setId(id);
        o.setStatus(status);
        return o;
    }

    private static Product product(ProductStatus status) {
        Product p = new Product();
        p.setStatus(status);
        return p;
    }

    @Test
    void allOffersClosed_usesInFlightStatus() {
        List<Offer> siblings = List.of(offer("a", OfferStatus.REJECTED), offer("b", OfferStatus.SENT));

        assertTrue(ProjectLifecycle.allOffersClosed(siblings, "b", OfferStatus.EXPIRED));
        assertFalse(ProjectLifecycle.allOffersClosed(siblings, "a", OfferStatus.REJECTED));
        assertFalse(ProjectLifecycle.allOffersClosed(siblings, "b", OfferStatus.ACCEPTED));
    }

    @Test
    void lastOfferRejected_cancelsOfferedProject() {
        Project p = project(ProjectStatus.OFFERED);
        List<Offer> siblings = List.of(offer("a", OfferStatus.SUPERSEDED), offer("b", OfferStatus.SENT));

        assertTrue(lifecycle.onOfferClosed(p, siblings, "b", OfferStatus.REJECTED));
        assertEquals(ProjectStatus.CANCELLED, p.getStatus());
    }

    @Test
    void lastOfferRejected_keepsApprovedProject() {
        Project p = project(ProjectStatus.APPROVED);

        assertFalse(lifecycle.onOfferClosed(p, List.of(offer("b", OfferStatus.SENT)), "b", OfferStatus.REJECTED));
        assertEquals(ProjectStatus.APPROVED, p.getStatus());
    }

    @Test
    void offerSent_onlyMovesDraft() {
        Project draft = project(ProjectStatus.DRAFT);
        Project approved = project(ProjectStatus.APPROVED);

        assertTrue(lifecycle.onOfferSent(draft));
        assertFalse(lifecycle.onOfferSent(approved));
        assertEquals(ProjectStatus.OFFERED, draft.getStatus());
    }

    @Test
    void fulfillment_liftsDraftOnlyWhenAsked() {
        Project p = project(ProjectStatus.DRAFT);

        assertFalse(lifecycle.onFulfillmentStarted(p, false));
        assertTrue(lifecycle.onFulfillmentStarted(p, true));
        assertEquals(ProjectStatus.IN_PRODUCTION, p.getStatus());
    }

    @Test
    void sync_completesWhenAllProductsFinished() {
        Project p = project(ProjectStatus.IN_PRODUCTION);

        assertTrue(lifecycle.sync(p, List.of(product(ProductStatus.READY), product(ProductStatus.INSTALLED))));
        assertEquals(ProjectStatus.COMPLETED, p.getStatus());
    }

    @Test
    void sync_skipsOfferedProject() {
        Project p = project(ProjectStatus.OFFERED);

        assertFalse(lifecycle.sync(p, List.of(product(ProductStatus.READY))));
        assertEquals(ProjectStatus.OFFERED, p.getStatus());
    }

    @Test
    void changeStatus_rejectsLeavingCompleted() {
        Project p = project(ProjectStatus.COMPLETED);

        assertThrows(IllegalTransitionException.class, () -> lifecycle.changeStatus(p, ProjectStatus.DRAFT));
    }
}

package com.furniture.workshop.lifecycle;

import com.furniture.workshop.exception.IllegalTransitionException;
import com.furniture.workshop.model.OrderDisplayStatus;
import com.furniture.workshop.model.OrderItemStatus;
import com.furniture.workshop.model.OrderStatus;
import com.furniture.workshop.model.PurchaseOrderItem;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrderLifecycleTest {

    private final OrderLifecycle lifecycle = new OrderLifecycle();

    private static PurchaseOrderItem item(OrderItemStatus status) {
        PurchaseOrderItem item = new PurchaseOrderItem();
        item.setStatus(status);
        return item;
    }

    @Test
    void send_onlyFromDraft() {
        assertEquals(OrderStatus.SENT, lifecycle.fire(OrderStatus.DRAFT, OrderEvent.SEND));
        assertEquals(OrderStatus.SENT, lifecycle.fire(OrderStatus.SENT, OrderEvent.SEND));
        assertThrows(IllegalTransitionException.class, () -> lifecycle.fire(OrderStatus.RECEIVED, OrderEvent.SEND));
    }

    @Test
    void receiveAll_requiresSent() {
        assertFalse(lifecycle.canFire(OrderStatus.DRAFT, OrderEvent.RECEIVE_ALL));
        assertTrue(lifecycle.canFire(OrderStatus.SENT, OrderEvent.RECEIVE_ALL));
    }

    @Test
    void eventFor_mapsTargets() {
        assertEquals(OrderEvent.REVERT_TO_DRAFT, lifecycle.eventFor(OrderStatus.SENT, OrderStatus.DRAFT));
        assertEquals(OrderEvent.RECEIVE_ALL, lifecycle.eventFor(OrderStatus.SENT, OrderStatus.RECEIVED));
    }

    @Test
    void displayStatus_derivesPartiallyReceived() {
        List<PurchaseOrderItem> items = List.of(item(OrderItemStatus.RECEIVED), item(OrderItemStatus.ORDERED));

        assertEquals(OrderDisplayStatus.PARTIALLY_RECEIVED, lifecycle.displayStatus(OrderStatus.SENT, items));
        assertEquals(OrderDisplayStatus.DRAFT, lifecycle.displayStatus(OrderStatus.DRAFT, items));
        assertEquals(OrderDisplayStatus.SENT,
                lifecycle.displayStatus(OrderStatus.SENT, List.of(item(OrderItemStatus.ORDERED))));
        assertEquals(OrderDisplayStatus.RECEIVED,
                lifecycle.displayStatus(OrderStatus.SENT, List.of(item(OrderItemStatus.RECEIVED))));
    }

    @Test
    void allReceived_falseForEmptyOrder() {
        assertFalse(lifecycle.allReceived(List.of()));
        assertTrue(lifecycle.allReceived(List.of(item(OrderItemStatus.RECEIVED))));
    }
}

package com.furniture.workshop.lifecycle;

import com.furniture.workshop.exception.IllegalTransitionException;
import com.furniture.workshop.model.OrderDisplayStatus;
import com.furniture.workshop.model.OrderItemStatus;
import com.furniture.workshop.model.OrderStatus;
import com.furniture.workshop.model.PurchaseOrderItem;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.furniture.workshop.model.OrderStatus.*;

@Component
public class OrderLifecycle {

    private static final TransitionTable<OrderStatus, OrderEvent> TABLE = TransitionTable
            .builder("order", OrderStatus.class, OrderEvent.class)
            .allow(DRAFT, OrderEvent.SEND, SENT)
            .allow(SENT, OrderEvent.RECEIVE_ALL, RECEIVED)
            .allow(SENT, OrderEvent.REVERT_TO_DRAFT, DRAFT)
            .allow(RECEIVED, OrderEvent.REVERT_TO_DRAFT, DRAFT)
            .build();

    public OrderStatus fire(OrderStatus current, OrderEvent event) {
        return TABLE.fire(current, event);
    }

    public boolean canFire(OrderStatus current, OrderEvent event) {
        return TABLE.canFire(current, event);
    }

    /** Maps a requested target status onto the event that reaches it. */
    public OrderEvent eventFor(OrderStatus current, OrderStatus target) {
        switch (target) {
            case SENT:
                return OrderEvent.SEND;
            case RECEIVED:
                return OrderEvent.RECEIVE_ALL;
            case DRAFT:
                return OrderEvent.REVERT_TO_DRAFT;
            default:
                throw new IllegalTransitionException("order", current, target);
        }
    }

    public boolean allReceived(List<PurchaseOrderItem> items) {
        return !items.isEmpty() && items.stream().allMatch(i -> i.getStatus() == OrderItemStatus.RECEIVED);
    }

    /** Display label; PARTIALLY_RECEIVED is derived here and never stored. */
    public OrderDisplayStatus displayStatus(OrderStatus status, List<PurchaseOrderItem> items) {
        if (status == DRAFT)
            return OrderDisplayStatus.DRAFT;
        long received = items.stream().filter(i -> i.getStatus() == OrderItemStatus.RECEIVED).count();
        if (status == RECEIVED || (!items.isEmpty() && received == items.size()))
            return OrderDisplayStatus.RECEIVED;
        return received > 0 ? OrderDisplayStatus.PARTIALLY_RECEIVED : OrderDisplayStatus.SENT;
    }
}

package com.furniture.workshop.dto;

import com.furniture.workshop.model.OrderStatus;

/** {@code confirmed} must be set to move a sent or received order back to draft. */
public record ChangeOrderStatusRequest(OrderStatus status, boolean confirmed) {
}

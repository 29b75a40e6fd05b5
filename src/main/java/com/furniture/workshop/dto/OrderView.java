package com.furniture.workshop.dto;

import com.furniture.workshop.model.OrderDisplayStatus;
import com.furniture.workshop.model.PurchaseOrder;

public record OrderView(PurchaseOrder order, OrderDisplayStatus displayStatus) {
}

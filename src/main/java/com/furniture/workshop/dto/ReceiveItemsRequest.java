package com.furniture.workshop.dto;

import java.util.List;

/** Empty or missing {@code itemIds} receives every item of the order. */
public record ReceiveItemsRequest(List<String> itemIds) {
}

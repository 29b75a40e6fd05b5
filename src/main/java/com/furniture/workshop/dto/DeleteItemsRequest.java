package com.furniture.workshop.dto;

import java.util.List;

public record DeleteItemsRequest(List<String> itemIds) {
}

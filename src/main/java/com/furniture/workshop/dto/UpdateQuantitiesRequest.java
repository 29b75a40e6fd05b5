package com.furniture.workshop.dto;

import java.math.BigDecimal;
import java.util.Map;

/** New quantity per order item id. */
public record UpdateQuantitiesRequest(Map<String, BigDecimal> quantities) {
}

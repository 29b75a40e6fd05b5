package com.furniture.workshop.dto;

import java.util.List;

/**
 * @param skippedReceived material names of selected items that were already
 *                        received and therefore kept
 * @param orderEmpty      the order has no items left; callers may offer to
 *                        delete it
 */
public record DeleteItemsResult(int deletedCount, List<String> skippedReceived, boolean orderEmpty) {
}

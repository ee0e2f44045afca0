package com.storefront.inventoryservice.model;

import lombok.Value;

/**
 * Outcome of one conditional stock decrement.
 * {@code previousStock} is the stock observed inside the same atomic step
 * that decided whether to apply the decrement.
 */
@Value
public class StockUpdate {

    String productId;
    int previousStock;
    int remainingStock;
    boolean applied;

    public static StockUpdate applied(String productId, int previousStock, int remainingStock) {
        return new StockUpdate(productId, previousStock, remainingStock, true);
    }

    public static StockUpdate rejected(String productId, int currentStock) {
        return new StockUpdate(productId, currentStock, currentStock, false);
    }
}

package com.storefront.common.exception;

import lombok.Getter;

/**
 * Exception thrown when there is insufficient stock for a product
 * HTTP Status: 400 Bad Request
 */
@Getter
public class InsufficientStockException extends RuntimeException {

    private final String productId;
    private final int available;
    private final int requested;

    public InsufficientStockException(String message, String productId, int available, int requested) {
        super(message);
        this.productId = productId;
        this.available = available;
        this.requested = requested;
    }
}

package com.storefront.orderservice.exception;

import lombok.Getter;

/**
 * Exception thrown when inventory-service refuses a reservation that the
 * preceding stock check allowed, typically because a concurrent order took
 * the stock in between.
 * HTTP Status: 500 Internal Server Error
 */
@Getter
public class ReservationFailedException extends RuntimeException {

    private final String productId;
    private final int upstreamStatus;
    private final String upstreamBody;

    public ReservationFailedException(String productId, int upstreamStatus, String upstreamBody) {
        super("Failed to reserve inventory for " + productId);
        this.productId = productId;
        this.upstreamStatus = upstreamStatus;
        this.upstreamBody = upstreamBody;
    }
}

package com.storefront.common.exception;

/**
 * Exception thrown when a product or an order does not exist
 * HTTP Status: 404 Not Found
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}

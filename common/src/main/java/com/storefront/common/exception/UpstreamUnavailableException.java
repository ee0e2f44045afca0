package com.storefront.common.exception;

/**
 * Exception thrown when a dependency cannot be reached: connection refused,
 * DNS failure or an outbound call that ran past its timeout.
 * HTTP Status: 503 Service Unavailable
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.storefront.common.exception;

/**
 * Exception thrown when a dependency answered, but with a body that is not
 * JSON or does not have the expected shape.
 * HTTP Status: 502 Bad Gateway
 */
public class MalformedUpstreamResponseException extends RuntimeException {

    public MalformedUpstreamResponseException(String message) {
        super(message);
    }

    public MalformedUpstreamResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.storefront.gateway.exception;

import lombok.Getter;

/**
 * The order service answered with a non-2xx status. The gateway replies with
 * the same status and the detail derived from the upstream body.
 */
@Getter
public class UpstreamStatusException extends RuntimeException {

    private final int status;

    public UpstreamStatusException(int status, String detail) {
        super(detail);
        this.status = status;
    }
}

package com.storefront.gateway.dto;

import lombok.Value;

/** Raw status and body text exactly as the order service answered. */
@Value
public class UpstreamReply {
    int status;
    String body;

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }
}

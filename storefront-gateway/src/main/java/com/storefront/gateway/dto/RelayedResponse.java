package com.storefront.gateway.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

/** A successful order-service answer, passed on to the caller unchanged. */
@Value
public class RelayedResponse {
    int status;
    JsonNode body;
}

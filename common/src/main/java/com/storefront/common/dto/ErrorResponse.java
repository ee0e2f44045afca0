package com.storefront.common.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Error envelope returned by every service.
 * The gateway reads {@code detail} back out of this envelope when it relays
 * an order-service failure to the end user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL) // Don't include null fields in JSON
public class ErrorResponse {

    private int status;
    private String error;
    private String detail;
    private String path;

    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime timestamp;

    // Error code for categorizing errors (e.g. "INSUFFICIENT_STOCK")
    private String errorCode;

    // Correlation ID, also written to the log line of the failure
    private String correlationId;
}

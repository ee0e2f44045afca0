package com.storefront.common.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a successful {@code POST /api/inventory/{productId}/reserve}.
 * Failed reservations are reported through the error envelope instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReserveStockResponse {
    private boolean success;
    private String productId;
    private Integer reservedQuantity;
    private Integer remainingStock;
}

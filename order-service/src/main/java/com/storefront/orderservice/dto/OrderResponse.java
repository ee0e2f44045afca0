package com.storefront.orderservice.dto;

import com.storefront.orderservice.model.OrderStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OrderResponse {
    private Long orderId;
    private String customerId;
    private List<OrderItemResponse> items;
    private BigDecimal totalValue;
    private OrderStatus status;
    private Instant createdAt;
}

package com.storefront.orderservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * A confirmed order. Orders are never modified or deleted after creation.
 */
@Value
@Builder
public class Order {

    // assigned by OrderIdGenerator before any reservation is attempted
    Long orderId;

    String customerId;

    // in request order
    List<OrderItem> items;

    BigDecimal totalValue;

    OrderStatus status;

    Instant createdAt;
}

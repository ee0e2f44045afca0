package com.storefront.orderservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One priced line of an order. Name and unit price are copied from inventory
 * at reservation time, so later catalogue changes do not affect the order.
 */
@Value
@Builder
public class OrderItem {

    String productId;

    String productName;

    int quantity;

    BigDecimal unitPrice;

    // unitPrice * quantity
    BigDecimal lineTotal;
}

package com.storefront.orderservice.service;

import com.storefront.orderservice.dto.OrderListResponse;
import com.storefront.orderservice.dto.OrderRequest;
import com.storefront.orderservice.dto.OrderResponse;

public interface OrderService {

    /**
     * Creates a new order.
     * For each requested item, in request order, this method reads the product
     * from inventory-service, checks the stock and reserves the quantity. The
     * first failing item aborts the whole request. Stock already reserved for
     * earlier items of the same request is NOT released.
     */
    OrderResponse createOrder(OrderRequest orderRequest);

    /**
     * Lists all orders, oldest first.
     */
    OrderListResponse getAllOrders();

    /**
     * Retrieves a single order.
     */
    OrderResponse getOrderById(Long orderId);
}

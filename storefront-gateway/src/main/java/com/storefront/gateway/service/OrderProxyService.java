package com.storefront.gateway.service;

import com.storefront.gateway.dto.RelayedResponse;

public interface OrderProxyService {

    RelayedResponse listOrders();

    RelayedResponse getOrder(Long orderId);

    /** Forwards the raw request body without looking at it. */
    RelayedResponse createOrder(String orderJson);
}

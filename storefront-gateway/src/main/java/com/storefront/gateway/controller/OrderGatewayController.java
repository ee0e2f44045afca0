package com.storefront.gateway.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.gateway.dto.RelayedResponse;
import com.storefront.gateway.service.OrderProxyService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/orders")
@RequiredArgsConstructor
public class OrderGatewayController {

    private final OrderProxyService orderProxyService;

    @GetMapping
    public ResponseEntity<JsonNode> getOrders() {
        return toResponse(orderProxyService.listOrders());
    }

    @GetMapping("/{orderId}")
    public ResponseEntity<JsonNode> getOrder(@PathVariable Long orderId) {
        return toResponse(orderProxyService.getOrder(orderId));
    }

    // Not validated here; the order service owns the request contract
    @PostMapping
    public ResponseEntity<JsonNode> createOrder(@RequestBody(required = false) String orderJson) {
        return toResponse(orderProxyService.createOrder(orderJson));
    }

    private static ResponseEntity<JsonNode> toResponse(RelayedResponse relayed) {
        return ResponseEntity.status(relayed.getStatus()).body(relayed.getBody());
    }
}

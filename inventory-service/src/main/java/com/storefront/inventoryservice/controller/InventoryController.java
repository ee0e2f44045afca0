package com.storefront.inventoryservice.controller;

import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.common.dto.ReserveStockResponse;
import com.storefront.inventoryservice.dto.InventoryListResponse;
import com.storefront.inventoryservice.services.ProductService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final ProductService productService;

    @GetMapping
    public ResponseEntity<InventoryListResponse> getAllInventory() {
        return ResponseEntity.ok(productService.getAllProducts());
    }

    @GetMapping("/{productId}")
    public ResponseEntity<InventoryItemResponse> getInventory(@PathVariable String productId) {
        return ResponseEntity.ok(productService.getProductById(productId));
    }

    // Called by order-service once per order line; quantity defaults to a single unit
    @PostMapping("/{productId}/reserve")
    public ResponseEntity<ReserveStockResponse> reserveInventory(
            @PathVariable String productId,
            @RequestParam(defaultValue = "1") int quantity) {
        return ResponseEntity.ok(productService.reserveProduct(productId, quantity));
    }
}

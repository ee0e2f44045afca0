package com.storefront.inventoryservice.services;

import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.common.dto.ReserveStockResponse;
import com.storefront.common.exception.InsufficientStockException;
import com.storefront.common.exception.ResourceNotFoundException;
import com.storefront.inventoryservice.dto.InventoryEntry;
import com.storefront.inventoryservice.dto.InventoryListResponse;
import com.storefront.inventoryservice.mapper.ProductMapper;
import com.storefront.inventoryservice.model.Product;
import com.storefront.inventoryservice.model.StockUpdate;
import com.storefront.inventoryservice.repository.ProductRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class ProductServiceImpl implements ProductService {

        private final ProductRepository productRepository;
        private final ProductMapper productMapper;
        private final MeterRegistry meterRegistry;

        @Override
        public InventoryListResponse getAllProducts() {
                List<Product> products = productRepository.findAll();

                Map<String, InventoryEntry> items = new LinkedHashMap<>();
                products.forEach(product -> items.put(product.getId(), productMapper.toInventoryEntry(product)));

                meterRegistry.counter("inventory.checks", "operation", "list_all").increment();
                log.info("Retrieved all inventory items: {} items", items.size());

                return InventoryListResponse.builder()
                                .items(items)
                                .totalItems(items.size())
                                .build();
        }

        @Override
        public InventoryItemResponse getProductById(String productId) {
                meterRegistry.counter("inventory.checks", "operation", "get_by_id").increment();

                Product product = productRepository.findById(productId)
                                .orElseThrow(() -> {
                                        log.warn("Product not found: productId={}", productId);
                                        return new ResourceNotFoundException("Product " + productId + " not found");
                                });

                log.info("Retrieved inventory: productId={}, stock={}", productId, product.getStock());
                return productMapper.toInventoryItemResponse(product);
        }

        @Override
        public ReserveStockResponse reserveProduct(String productId, int quantity) {
                if (quantity < 1) {
                        log.warn("Reservation rejected: productId={}, quantity={} is not positive", productId, quantity);
                        throw new IllegalArgumentException("Quantity must be at least 1");
                }

                StockUpdate update = productRepository.decreaseStock(productId, quantity)
                                .orElseThrow(() -> {
                                        log.warn("Cannot reserve - product not found: productId={}", productId);
                                        return new ResourceNotFoundException("Product " + productId + " not found");
                                });

                if (!update.isApplied()) {
                        log.warn("Insufficient stock: productId={}, requested={}, available={}",
                                        productId, quantity, update.getPreviousStock());
                        meterRegistry.counter("inventory.reservations", "outcome", "insufficient_stock").increment();
                        throw new InsufficientStockException(
                                        String.format("Insufficient stock. Available: %d, Requested: %d",
                                                        update.getPreviousStock(), quantity),
                                        productId, update.getPreviousStock(), quantity);
                }

                meterRegistry.counter("inventory.reservations", "outcome", "reserved").increment();
                log.info("Stock reserved: productId={}, quantity={}, oldStock={}, newStock={}",
                                productId, quantity, update.getPreviousStock(), update.getRemainingStock());

                return ReserveStockResponse.builder()
                                .success(true)
                                .productId(productId)
                                .reservedQuantity(quantity)
                                .remainingStock(update.getRemainingStock())
                                .build();
        }
}

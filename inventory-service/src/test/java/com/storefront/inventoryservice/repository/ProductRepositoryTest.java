package com.storefront.inventoryservice.repository;

import com.storefront.inventoryservice.model.Product;
import com.storefront.inventoryservice.model.StockUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ProductRepository Tests")
class ProductRepositoryTest {

    private ProductRepository productRepository;

    @BeforeEach
    void setUp() {
        productRepository = new ProductRepository();
        productRepository.save(product("laptop", 25));
    }

    private static Product product(String id, int stock) {
        return Product.builder()
                .id(id)
                .name("Laptop Pro")
                .stock(stock)
                .price(new BigDecimal("1299.99"))
                .build();
    }

    @Test
    void should_decrease_stock_when_enough_units_remain() {
        Optional<StockUpdate> update = productRepository.decreaseStock("laptop", 5);

        assertThat(update).isPresent();
        assertThat(update.get().isApplied()).isTrue();
        assertThat(update.get().getPreviousStock()).isEqualTo(25);
        assertThat(update.get().getRemainingStock()).isEqualTo(20);
        assertThat(productRepository.findById("laptop").orElseThrow().getStock()).isEqualTo(20);
    }

    @Test
    void should_allow_reserving_the_last_unit() {
        Optional<StockUpdate> update = productRepository.decreaseStock("laptop", 25);

        assertThat(update.orElseThrow().isApplied()).isTrue();
        assertThat(update.get().getRemainingStock()).isZero();
    }

    @Test
    void should_leave_stock_unchanged_when_request_exceeds_stock() {
        Optional<StockUpdate> update = productRepository.decreaseStock("laptop", 26);

        assertThat(update).isPresent();
        assertThat(update.get().isApplied()).isFalse();
        assertThat(update.get().getPreviousStock()).isEqualTo(25);
        assertThat(productRepository.findById("laptop").orElseThrow().getStock()).isEqualTo(25);
    }

    @Test
    void should_return_empty_for_unknown_product() {
        assertThat(productRepository.decreaseStock("toaster", 1)).isEmpty();
        assertThat(productRepository.findById("toaster")).isEmpty();
    }

    @Test
    void should_list_products_ordered_by_id() {
        productRepository.save(product("mouse", 150));
        productRepository.save(product("headset", 60));

        assertThat(productRepository.findAll())
                .extracting(Product::getId)
                .containsExactly("headset", "laptop", "mouse");
        assertThat(productRepository.count()).isEqualTo(3);
    }

    @RepeatedTest(5) // Run 5 times to catch intermittent race conditions
    void should_grant_exactly_stock_many_single_unit_reservations_under_contention() throws Exception {
        // 1. ARRANGE: 10 units, 50 competing single-unit reservations
        productRepository.save(product("laptop", 10));
        int attempts = 50;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch startGate = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        // 2. ACT
        for (int i = 0; i < attempts; i++) {
            results.add(executor.submit(() -> {
                startGate.await();
                return productRepository.decreaseStock("laptop", 1).orElseThrow().isApplied();
            }));
        }
        startGate.countDown();

        int successCount = 0;
        for (Future<Boolean> result : results) {
            if (result.get(5, TimeUnit.SECONDS)) {
                successCount++;
            }
        }
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);

        // 3. ASSERT: exactly the initial stock was granted, nothing oversold
        assertThat(successCount).isEqualTo(10);
        assertThat(attempts - successCount).isEqualTo(40);
        assertThat(productRepository.findById("laptop").orElseThrow().getStock()).isZero();
    }

    @RepeatedTest(5)
    void should_never_go_negative_with_mixed_reservation_sizes() throws Exception {
        // 3 units, five threads asking for 2 each: only one can win
        productRepository.save(product("laptop", 3));
        ExecutorService executor = Executors.newFixedThreadPool(5);
        List<Future<StockUpdate>> results = new ArrayList<>();

        for (int i = 0; i < 5; i++) {
            results.add(executor.submit(() -> productRepository.decreaseStock("laptop", 2).orElseThrow()));
        }

        int granted = 0;
        for (Future<StockUpdate> result : results) {
            StockUpdate update = result.get(5, TimeUnit.SECONDS);
            if (update.isApplied()) {
                granted += 2;
            }
            assertThat(update.getRemainingStock()).isGreaterThanOrEqualTo(0);
        }
        executor.shutdown();

        assertThat(granted).isEqualTo(2);
        assertThat(productRepository.findById("laptop").orElseThrow().getStock()).isEqualTo(1);
    }
}

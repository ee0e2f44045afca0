package com.storefront.inventoryservice.repository;

import com.storefront.inventoryservice.model.Product;
import com.storefront.inventoryservice.model.StockUpdate;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory product store. Lives as long as the application context.
 */
@Repository
public class ProductRepository {

    private final Map<String, Product> products = new ConcurrentHashMap<>();

    public Product save(Product product) {
        products.put(product.getId(), product);
        return product;
    }

    public Optional<Product> findById(String productId) {
        return Optional.ofNullable(products.get(productId));
    }

    // ordered by product id
    public List<Product> findAll() {
        return products.values().stream()
                .sorted(Comparator.comparing(Product::getId))
                .collect(Collectors.toList());
    }

    public long count() {
        return products.size();
    }

    /**
     * Decreases stock by {@code quantity} only if at least that many units remain.
     * The check and the write run inside {@link ConcurrentHashMap#computeIfPresent},
     * which is atomic per key, so concurrent reservations of the same product
     * serialize and stock can never go negative.
     *
     * @return empty if the product does not exist, otherwise the outcome of the attempt
     */
    public Optional<StockUpdate> decreaseStock(String productId, int quantity) {
        AtomicReference<StockUpdate> outcome = new AtomicReference<>();
        products.computeIfPresent(productId, (id, product) -> {
            int stock = product.getStock();
            if (stock < quantity) {
                outcome.set(StockUpdate.rejected(id, stock));
                return product;
            }
            Product updated = product.toBuilder().stock(stock - quantity).build();
            outcome.set(StockUpdate.applied(id, stock, updated.getStock()));
            return updated;
        });
        return Optional.ofNullable(outcome.get());
    }
}

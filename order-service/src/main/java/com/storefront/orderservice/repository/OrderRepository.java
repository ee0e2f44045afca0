package com.storefront.orderservice.repository;

import com.storefront.orderservice.model.Order;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentNavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory order store, ordered by order id. Lives as long as the application context.
 */
@Repository
public class OrderRepository {

    private final ConcurrentNavigableMap<Long, Order> orders = new ConcurrentSkipListMap<>();

    public Order save(Order order) {
        orders.put(order.getOrderId(), order);
        return order;
    }

    public Optional<Order> findById(Long orderId) {
        return Optional.ofNullable(orders.get(orderId));
    }

    public List<Order> findAll() {
        return new ArrayList<>(orders.values());
    }

    public long count() {
        return orders.size();
    }
}

package com.storefront.orderservice.repository;

import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands out order ids in strictly increasing order, starting at 1000.
 * An id is consumed as soon as an order attempt starts, so ids of orders that
 * failed during reservation are never reused and show up as gaps.
 */
@Component
public class OrderIdGenerator {

    public static final long FIRST_ORDER_ID = 1000L;

    private final AtomicLong nextId = new AtomicLong(FIRST_ORDER_ID);

    public long nextId() {
        return nextId.getAndIncrement();
    }
}

package com.storefront.inventoryservice.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A product held by the inventory store.
 * <p>
 * Instances are immutable: a reservation replaces the stored value with a copy
 * carrying the new stock, so a reader never sees a half-applied update.
 */
@Value
@Builder(toBuilder = true)
public class Product {

    String id;

    String name;

    // never negative; only ProductRepository.decreaseStock lowers it
    int stock;

    BigDecimal price;
}

package com.storefront.orderservice.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderStatus {
    // The only status ever produced: an order is stored only once every line was reserved
    CONFIRMED;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}

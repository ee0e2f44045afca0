package com.storefront.orderservice.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class OrderRequest {
    @NotBlank(message = "Customer ID cannot be blank")
    private String customerId;

    @NotEmpty(message = "Order must contain at least one item")
    @Valid // Triggers validation for each OrderItemRequest in the list
    private List<OrderItemRequest> items;
}

package com.storefront.orderservice.mapper;

import com.storefront.orderservice.dto.OrderItemResponse;
import com.storefront.orderservice.dto.OrderResponse;
import com.storefront.orderservice.model.Order;
import com.storefront.orderservice.model.OrderItem;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderMapper {

    // Order -> OrderResponse (items are mapped one by one through toOrderItemResponse)
    OrderResponse toOrderResponse(Order order);

    OrderItemResponse toOrderItemResponse(OrderItem orderItem);

    // Note: there is no request -> entity mapper.
    // Names and prices come from inventory-service, so the service layer builds the entity.
}

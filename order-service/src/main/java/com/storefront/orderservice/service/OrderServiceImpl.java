package com.storefront.orderservice.service;

import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.common.exception.InsufficientStockException;
import com.storefront.common.exception.ResourceNotFoundException;
import com.storefront.orderservice.client.InventoryClient;
import com.storefront.orderservice.dto.OrderItemRequest;
import com.storefront.orderservice.dto.OrderListResponse;
import com.storefront.orderservice.dto.OrderRequest;
import com.storefront.orderservice.dto.OrderResponse;
import com.storefront.orderservice.mapper.OrderMapper;
import com.storefront.orderservice.model.Order;
import com.storefront.orderservice.model.OrderItem;
import com.storefront.orderservice.model.OrderStatus;
import com.storefront.orderservice.repository.OrderIdGenerator;
import com.storefront.orderservice.repository.OrderRepository;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderServiceImpl implements OrderService {

    private final OrderRepository orderRepository;
    private final OrderIdGenerator orderIdGenerator;
    private final InventoryClient inventoryClient;
    private final OrderMapper orderMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public OrderResponse createOrder(OrderRequest orderRequest) {
        // The id is taken up front; a failed attempt still consumes it
        long orderId = orderIdGenerator.nextId();
        log.info("Order creation process started. orderId={}, customerId={}, itemCount={}",
                orderId, orderRequest.getCustomerId(), orderRequest.getItems().size());

        BigDecimal totalValue = BigDecimal.ZERO;
        List<OrderItem> orderItems = new ArrayList<>();

        // Strictly sequential: which items are reserved at the moment of a failure depends on this order
        for (OrderItemRequest reqItem : orderRequest.getItems()) {
            try {
                OrderItem item = reserveLine(reqItem);
                orderItems.add(item);
                totalValue = totalValue.add(item.getLineTotal());
            } catch (RuntimeException e) {
                abandon(orderId, reqItem.getProductId(), orderItems, e);
                throw e;
            }
        }

        log.info("All items reserved. orderId={}, totalValue={}", orderId, totalValue);

        Order order = Order.builder()
                .orderId(orderId)
                .customerId(orderRequest.getCustomerId())
                .items(List.copyOf(orderItems))
                .totalValue(totalValue)
                .status(OrderStatus.CONFIRMED)
                .createdAt(Instant.now())
                .build();

        Order savedOrder = orderRepository.save(order);

        meterRegistry.counter("orders.created").increment();
        DistributionSummary.builder("orders.value")
                .baseUnit("USD")
                .description("Order values")
                .register(meterRegistry)
                .record(totalValue.doubleValue());

        log.info("Order created successfully: orderId={}, customerId={}, totalValue={}",
                savedOrder.getOrderId(), savedOrder.getCustomerId(), savedOrder.getTotalValue());

        return orderMapper.toOrderResponse(savedOrder);
    }

    /**
     * Read, check and reserve one line. Name and price come from the read,
     * so the line is priced as of this moment.
     */
    private OrderItem reserveLine(OrderItemRequest reqItem) {
        String productId = reqItem.getProductId();
        int quantity = reqItem.getQuantity();

        InventoryItemResponse product = inventoryClient.getProduct(productId);

        if (product.getStock() < quantity) {
            log.warn("Insufficient stock: productId={}, available={}, requested={}",
                    productId, product.getStock(), quantity);
            throw new InsufficientStockException(
                    String.format("Insufficient stock for %s. Available: %d, Requested: %d",
                            productId, product.getStock(), quantity),
                    productId, product.getStock(), quantity);
        }

        inventoryClient.reserve(productId, quantity);

        BigDecimal lineTotal = product.getPrice().multiply(BigDecimal.valueOf(quantity));
        log.info("Item reserved: productId={}, quantity={}, unitPrice={}, lineTotal={}",
                productId, quantity, product.getPrice(), lineTotal);

        return OrderItem.builder()
                .productId(productId)
                .productName(product.getName())
                .quantity(quantity)
                .unitPrice(product.getPrice())
                .lineTotal(lineTotal)
                .build();
    }

    // Reservations already made for this order stay in place; there is no compensation step
    private void abandon(long orderId, String failedProductId, List<OrderItem> reservedItems, RuntimeException cause) {
        meterRegistry.counter("orders.aborted", "reason", cause.getClass().getSimpleName()).increment();

        if (reservedItems.isEmpty()) {
            log.warn("Order aborted: orderId={}, failedProductId={}, reason={}",
                    orderId, failedProductId, cause.getMessage());
            return;
        }

        String leaked = reservedItems.stream()
                .map(item -> item.getProductId() + "x" + item.getQuantity())
                .collect(Collectors.joining(", "));
        log.warn("Order aborted after partial reservation: orderId={}, failedProductId={}, reason={}, "
                        + "reservedAndNotReleased=[{}]",
                orderId, failedProductId, cause.getMessage(), leaked);
    }

    @Override
    public OrderListResponse getAllOrders() {
        List<OrderResponse> orders = orderRepository.findAll().stream()
                .map(orderMapper::toOrderResponse)
                .collect(Collectors.toList());

        log.info("Retrieved all orders: {} orders", orders.size());
        return OrderListResponse.builder()
                .orders(orders)
                .total(orders.size())
                .build();
    }

    @Override
    public OrderResponse getOrderById(Long orderId) {
        Order order = orderRepository.findById(orderId)
                .orElseThrow(() -> {
                    log.warn("Order not found: orderId={}", orderId);
                    return new ResourceNotFoundException("Order " + orderId + " not found");
                });

        log.info("Retrieved order: orderId={}", orderId);
        return orderMapper.toOrderResponse(order);
    }
}

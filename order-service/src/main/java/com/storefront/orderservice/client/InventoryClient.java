package com.storefront.orderservice.client;

import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.common.dto.ReserveStockResponse;
import com.storefront.common.exception.MalformedUpstreamResponseException;
import com.storefront.common.exception.ResourceNotFoundException;
import com.storefront.common.exception.UpstreamUnavailableException;
import com.storefront.orderservice.config.InventoryClientProperties;
import com.storefront.orderservice.exception.ReservationFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.codec.CodecException;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Blocking client for the inventory-service read/reserve contract.
 * <p>
 * Every call is bounded by {@code inventory.client.timeout}. Failures are
 * translated into the platform's exception taxonomy:
 * <ul>
 *   <li>4xx on read: {@link ResourceNotFoundException}</li>
 *   <li>any error status on reserve: {@link ReservationFailedException}</li>
 *   <li>connection failure, timeout or a 5xx on read: {@link UpstreamUnavailableException}</li>
 *   <li>unreadable or incomplete body: {@link MalformedUpstreamResponseException}</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InventoryClient {

    private final WebClient inventoryServiceWebClient;
    private final InventoryClientProperties properties;

    public InventoryItemResponse getProduct(String productId) {
        log.info("Checking inventory: productId={}", productId);

        InventoryItemResponse product = inventoryServiceWebClient.get()
                .uri("/api/inventory/{productId}", productId)
                .retrieve()
                // inventory answered but would not serve this id (404, or 400 for ids it cannot route)
                .onStatus(HttpStatusCode::is4xxClientError,
                        response -> Mono.error(new ResourceNotFoundException(
                                "Product " + productId + " not found in inventory")))
                .onStatus(HttpStatusCode::is5xxServerError,
                        response -> Mono.error(new UpstreamUnavailableException(
                                "Inventory service returned HTTP " + response.statusCode().value()
                                        + " while reading product " + productId)))
                .bodyToMono(InventoryItemResponse.class)
                .timeout(properties.getTimeout(), Mono.error(() -> timedOut(productId)))
                .onErrorMap(ex -> translateFailure(ex, productId))
                .block();

        if (product == null || product.getStock() == null || product.getPrice() == null) {
            log.error("Incomplete inventory record: productId={}, body={}", productId, product);
            throw new MalformedUpstreamResponseException(
                    "Invalid response from inventory service for product " + productId);
        }
        return product;
    }

    public ReserveStockResponse reserve(String productId, int quantity) {
        log.info("Reserving inventory: productId={}, quantity={}", productId, quantity);

        ReserveStockResponse reservation = inventoryServiceWebClient.post()
                .uri(uriBuilder -> uriBuilder
                        .path("/api/inventory/{productId}/reserve")
                        .queryParam("quantity", quantity)
                        .build(productId))
                .retrieve()
                .onStatus(HttpStatusCode::isError,
                        response -> response.bodyToMono(String.class)
                                .defaultIfEmpty("")
                                .map(body -> {
                                    log.error("Failed to reserve inventory: productId={}, status={}, body={}",
                                            productId, response.statusCode().value(), body);
                                    return new ReservationFailedException(productId,
                                            response.statusCode().value(), body);
                                }))
                .bodyToMono(ReserveStockResponse.class)
                .timeout(properties.getTimeout(), Mono.error(() -> timedOut(productId)))
                .onErrorMap(ex -> translateFailure(ex, productId))
                .block();

        if (reservation == null || !reservation.isSuccess()) {
            log.error("Unexpected reservation response: productId={}, body={}", productId, reservation);
            throw new MalformedUpstreamResponseException(
                    "Invalid reservation response from inventory service for product " + productId);
        }
        return reservation;
    }

    private UpstreamUnavailableException timedOut(String productId) {
        log.error("Inventory service timed out: productId={}, timeout={}", productId, properties.getTimeout());
        return new UpstreamUnavailableException(
                "Unable to reach inventory service: no response within " + properties.getTimeout());
    }

    private Throwable translateFailure(Throwable ex, String productId) {
        if (ex instanceof WebClientRequestException) {
            log.error("Error communicating with inventory service: productId={}, error={}",
                    productId, ex.getMessage());
            return new UpstreamUnavailableException("Unable to reach inventory service: " + ex.getMessage(), ex);
        }
        // Error statuses are already handled above, so what is left here is a 2xx body we could not read
        if (ex instanceof CodecException || ex instanceof WebClientResponseException) {
            log.error("Unreadable inventory response: productId={}, error={}", productId, ex.getMessage());
            return new MalformedUpstreamResponseException(
                    "Invalid response from inventory service for product " + productId, ex);
        }
        return ex;
    }
}

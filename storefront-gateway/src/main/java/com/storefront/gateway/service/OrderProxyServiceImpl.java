package com.storefront.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.common.exception.MalformedUpstreamResponseException;
import com.storefront.common.exception.UpstreamUnavailableException;
import com.storefront.gateway.config.OrdersClientProperties;
import com.storefront.gateway.dto.RelayedResponse;
import com.storefront.gateway.dto.UpstreamReply;
import com.storefront.gateway.exception.UpstreamStatusException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

@Service
@RequiredArgsConstructor
@Slf4j
public class OrderProxyServiceImpl implements OrderProxyService {

    private static final int BODY_EXCERPT_LENGTH = 100;

    private final WebClient ordersServiceWebClient;
    private final OrdersClientProperties properties;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public RelayedResponse listOrders() {
        log.info("Fetching orders from orders service");

        UpstreamReply reply = send("list", ordersServiceWebClient.get()
                .uri("/api/orders")
                .exchangeToMono(this::readReply), properties.getReadTimeout());

        if (!reply.isSuccess()) {
            log.error("Failed to fetch orders: status={}", reply.getStatus());
            throw rejected("list", reply.getStatus(), "Orders API error: " + extractDetail(reply));
        }

        RelayedResponse relayed = relay("list", reply);
        log.info("Fetched orders: total={}", relayed.getBody().path("total").asInt(0));
        return relayed;
    }

    @Override
    public RelayedResponse getOrder(Long orderId) {
        log.info("Fetching order from orders service: orderId={}", orderId);

        UpstreamReply reply = send("get", ordersServiceWebClient.get()
                .uri("/api/orders/{orderId}", orderId)
                .exchangeToMono(this::readReply), properties.getReadTimeout());

        if (reply.getStatus() == HttpStatus.NOT_FOUND.value()) {
            log.warn("Order not found: orderId={}", orderId);
            throw rejected("get", reply.getStatus(), "Order " + orderId + " not found");
        }
        if (!reply.isSuccess()) {
            log.error("Failed to fetch order: orderId={}, status={}", orderId, reply.getStatus());
            throw rejected("get", reply.getStatus(), "Failed to fetch order from Orders API");
        }

        RelayedResponse relayed = relay("get", reply);
        log.info("Fetched order: orderId={}", orderId);
        return relayed;
    }

    @Override
    public RelayedResponse createOrder(String orderJson) {
        log.info("Forwarding order creation to orders service");

        UpstreamReply reply = send("create", ordersServiceWebClient.post()
                .uri("/api/orders")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(orderJson == null ? "" : orderJson)
                .exchangeToMono(this::readReply), properties.getCreateTimeout());

        if (!reply.isSuccess()) {
            String detail = extractDetail(reply);
            log.error("Failed to create order: status={}, detail={}", reply.getStatus(), detail);
            throw rejected("create", reply.getStatus(), detail);
        }

        RelayedResponse relayed = relay("create", reply);
        log.info("Order created via orders service: orderId={}", relayed.getBody().path("order_id").asText());
        return relayed;
    }

    private Mono<UpstreamReply> readReply(ClientResponse response) {
        return response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new UpstreamReply(response.statusCode().value(), body));
    }

    private UpstreamReply send(String operation, Mono<UpstreamReply> exchange, Duration timeout) {
        return exchange
                .timeout(timeout)
                .onErrorMap(ex -> ex instanceof WebClientRequestException || ex instanceof TimeoutException,
                        ex -> networkFailure(operation, ex))
                .block();
    }

    private UpstreamUnavailableException networkFailure(String operation, Throwable ex) {
        // report the underlying I/O failure rather than the client wrapper
        Throwable cause = ex instanceof WebClientRequestException && ex.getCause() != null ? ex.getCause() : ex;
        String message = String.format("Network error communicating with orders service at %s: %s: %s",
                properties.getBaseUrl(), cause.getClass().getSimpleName(), cause.getMessage());
        log.error(message);
        count(operation, "unavailable");
        return new UpstreamUnavailableException(message, ex);
    }

    private RelayedResponse relay(String operation, UpstreamReply reply) {
        JsonNode body;
        try {
            // a JSON value followed by anything else is not a valid answer either
            body = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(reply.getBody());
        } catch (JsonProcessingException e) {
            body = null;
        }
        if (body == null || body.isMissingNode()) {
            log.error("Failed to parse orders service response as JSON: operation={}, response={}",
                    operation, excerpt(reply.getBody(), 200));
            count(operation, "malformed");
            throw new MalformedUpstreamResponseException(
                    "Invalid response from orders service. Response: " + excerpt(reply.getBody(), BODY_EXCERPT_LENGTH));
        }
        count(operation, "relayed");
        return new RelayedResponse(reply.getStatus(), body);
    }

    private UpstreamStatusException rejected(String operation, int status, String detail) {
        count(operation, "rejected");
        return new UpstreamStatusException(status, detail);
    }

    /**
     * Detail for a failed upstream call: the {@code detail} field of the error
     * envelope if there is one, otherwise the raw body, otherwise the status.
     */
    String extractDetail(UpstreamReply reply) {
        String body = reply.getBody();
        if (body == null || body.isEmpty()) {
            return "HTTP " + reply.getStatus();
        }
        try {
            JsonNode detail = objectMapper.readTree(body).get("detail");
            if (detail != null && !detail.isNull()) {
                return detail.isTextual() ? detail.asText() : detail.toString();
            }
        } catch (JsonProcessingException e) {
            log.debug("Upstream error body is not JSON, relaying it as text");
        }
        return body;
    }

    private static String excerpt(String body, int length) {
        return body.length() <= length ? body : body.substring(0, length);
    }

    private void count(String operation, String outcome) {
        meterRegistry.counter("gateway.order_requests", "operation", operation, "outcome", outcome).increment();
    }
}

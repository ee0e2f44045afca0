package com.storefront.orderservice;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.common.dto.InventoryItemResponse;
import com.storefront.common.dto.ReserveStockResponse;
import com.storefront.common.exception.MalformedUpstreamResponseException;
import com.storefront.common.exception.ResourceNotFoundException;
import com.storefront.common.exception.UpstreamUnavailableException;
import com.storefront.orderservice.client.InventoryClient;
import com.storefront.orderservice.exception.ReservationFailedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
class OrderApiIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private InventoryClient inventoryClient;

    private void stockProduct(String id, String name, int stock, String price) {
        when(inventoryClient.getProduct(id)).thenReturn(InventoryItemResponse.builder()
                .productId(id).name(name).stock(stock).price(new BigDecimal(price)).available(stock > 0).build());
    }

    private void acceptReservation(String id, int quantity) {
        when(inventoryClient.reserve(id, quantity)).thenReturn(ReserveStockResponse.builder()
                .success(true).productId(id).reservedQuantity(quantity).remainingStock(0).build());
    }

    @Test
    void should_create_confirmed_order_and_serve_it_back() throws Exception {
        stockProduct("mouse", "Wireless Mouse", 150, "29.99");
        stockProduct("keyboard", "Mechanical Keyboard", 75, "89.99");
        acceptReservation("mouse", 2);
        acceptReservation("keyboard", 1);

        MvcResult result = mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"customer_id": "c1", "items": [
                                  {"product_id": "mouse", "quantity": 2},
                                  {"product_id": "keyboard", "quantity": 1}
                                ]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.customer_id").value("c1"))
                .andExpect(jsonPath("$.status").value("confirmed"))
                .andExpect(jsonPath("$.total_value").value(149.97))
                .andExpect(jsonPath("$.items[0].product_name").value("Wireless Mouse"))
                .andExpect(jsonPath("$.items[0].unit_price").value(29.99))
                .andExpect(jsonPath("$.items[0].line_total").value(59.98))
                .andExpect(jsonPath("$.created_at").exists())
                .andReturn();

        JsonNode created = objectMapper.readTree(result.getResponse().getContentAsString());
        long orderId = created.get("order_id").asLong();

        mockMvc.perform(get("/api/orders/{orderId}", orderId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.order_id").value(orderId))
                .andExpect(jsonPath("$.items.length()").value(2));

        mockMvc.perform(get("/api/orders"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").isNumber())
                .andExpect(jsonPath("$.orders").isArray());
    }

    @Test
    void should_return_404_for_unknown_product() throws Exception {
        when(inventoryClient.getProduct("toaster"))
                .thenThrow(new ResourceNotFoundException("Product toaster not found in inventory"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"c1\", \"items\": [{\"product_id\": \"toaster\", \"quantity\": 1}]}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Product toaster not found in inventory"))
                .andExpect(jsonPath("$.error_code").value("RESOURCE_NOT_FOUND"));
    }

    @Test
    void should_return_400_when_stock_is_short() throws Exception {
        stockProduct("monitor", "4K Monitor", 2, "449.99");

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"c1\", \"items\": [{\"product_id\": \"monitor\", \"quantity\": 3}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail").value("Insufficient stock for monitor. Available: 2, Requested: 3"))
                .andExpect(jsonPath("$.error_code").value("INSUFFICIENT_STOCK"));

        verify(inventoryClient, never()).reserve(eq("monitor"), anyInt());
    }

    @Test
    void should_return_500_when_reservation_is_refused() throws Exception {
        stockProduct("headset", "Gaming Headset", 5, "79.99");
        when(inventoryClient.reserve("headset", 5))
                .thenThrow(new ReservationFailedException("headset", 400, "{\"detail\":\"Insufficient stock\"}"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"c1\", \"items\": [{\"product_id\": \"headset\", \"quantity\": 5}]}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Failed to reserve inventory for headset"))
                .andExpect(jsonPath("$.error_code").value("RESERVATION_FAILED"));
    }

    @Test
    void should_return_503_when_inventory_is_unreachable() throws Exception {
        when(inventoryClient.getProduct("laptop"))
                .thenThrow(new UpstreamUnavailableException("Unable to reach inventory service: Connection refused"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"c1\", \"items\": [{\"product_id\": \"laptop\", \"quantity\": 1}]}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.detail", containsString("Unable to reach inventory service")));
    }

    @Test
    void should_return_502_when_inventory_answers_garbage() throws Exception {
        when(inventoryClient.getProduct("laptop"))
                .thenThrow(new MalformedUpstreamResponseException("Invalid response from inventory service for product laptop"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"c1\", \"items\": [{\"product_id\": \"laptop\", \"quantity\": 1}]}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error_code").value("MALFORMED_UPSTREAM_RESPONSE"));
    }

    @Test
    void should_reject_invalid_order_requests() throws Exception {
        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"\", \"items\": [{\"product_id\": \"mouse\", \"quantity\": 0}]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.validation_errors.customerId").exists())
                .andExpect(jsonPath("$.validation_errors['items[0].quantity']").value("Quantity must be at least 1"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"customer_id\": \"c1\", \"items\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.validation_errors.items").value("Order must contain at least one item"));

        mockMvc.perform(post("/api/orders")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("MALFORMED_REQUEST"));

        verify(inventoryClient, never()).getProduct(anyString());
    }

    @Test
    void should_return_404_for_unknown_order_and_400_for_non_numeric_id() throws Exception {
        mockMvc.perform(get("/api/orders/{orderId}", 999_999))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.detail").value("Order 999999 not found"));

        mockMvc.perform(get("/api/orders/abc"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_ARGUMENT"));
    }

    @Test
    void should_describe_service_with_inventory_location() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.service").value("Orders API"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(jsonPath("$.endpoints[1]").value("/api/orders"))
                .andExpect(jsonPath("$.inventory_api").value("http://localhost:8000"));
    }

    @Test
    void should_report_health() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("orders-api"));
    }
}

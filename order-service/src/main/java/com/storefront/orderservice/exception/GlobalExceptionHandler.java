package com.storefront.orderservice.exception;

import com.storefront.common.dto.ErrorResponse;
import com.storefront.common.dto.ValidationErrorResponse;
import com.storefront.common.exception.InsufficientStockException;
import com.storefront.common.exception.MalformedUpstreamResponseException;
import com.storefront.common.exception.ResourceNotFoundException;
import com.storefront.common.exception.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps the order workflow's failures to distinguishable statuses:
 * 404 unknown product or order, 400 insufficient stock or bad input,
 * 500 reservation refused after a successful check,
 * 502 unreadable inventory response, 503 inventory unreachable.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatus status, String detail, String errorCode,
                                                        String correlationId, HttpServletRequest request) {
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(status.getReasonPhrase())
                .detail(detail)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFoundException(
            ResourceNotFoundException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.NOT_FOUND, ex.getMessage(), "RESOURCE_NOT_FOUND",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(InsufficientStockException.class)
    public ResponseEntity<ErrorResponse> handleInsufficientStockException(
            InsufficientStockException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INSUFFICIENT_STOCK",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(ReservationFailedException.class)
    public ResponseEntity<ErrorResponse> handleReservationFailedException(
            ReservationFailedException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Reservation refused by inventory - Path: {} - productId={}, upstreamStatus={}",
                correlationId, request.getRequestURI(), ex.getProductId(), ex.getUpstreamStatus());

        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), "RESERVATION_FAILED",
                correlationId, request);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailableException(
            UpstreamUnavailableException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Inventory service unavailable - Path: {} - {}",
                correlationId, request.getRequestURI(), ex.getMessage());

        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "UPSTREAM_UNAVAILABLE",
                correlationId, request);
    }

    @ExceptionHandler(MalformedUpstreamResponseException.class)
    public ResponseEntity<ErrorResponse> handleMalformedUpstreamResponseException(
            MalformedUpstreamResponseException ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();
        log.error("[{}] Malformed inventory response - Path: {} - {}",
                correlationId, request.getRequestURI(), ex.getMessage());

        return buildResponse(HttpStatus.BAD_GATEWAY, ex.getMessage(), "MALFORMED_UPSTREAM_RESPONSE",
                correlationId, request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ValidationErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        Map<String, String> validationErrors = new HashMap<>();

        ex.getBindingResult().getAllErrors().forEach(error -> {
            if (error instanceof FieldError fieldError) {
                validationErrors.put(fieldError.getField(), error.getDefaultMessage());
            }
        });

        String correlationId = generateCorrelationId();
        log.debug("[{}] Validation failed - Path: {} - Errors: {}", correlationId, request.getRequestURI(), validationErrors);

        ValidationErrorResponse errorResponse = ValidationErrorResponse.builder()
                .status(HttpStatus.BAD_REQUEST.value())
                .detail("Validation failed")
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .validationErrors(validationErrors)
                .errorCode("VALIDATION_FAILED")
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, "Request body is missing or is not valid JSON",
                "MALFORMED_REQUEST", generateCorrelationId(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST,
                String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName()),
                "INVALID_ARGUMENT", generateCorrelationId(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST, ex.getMessage(), "INVALID_ARGUMENT",
                generateCorrelationId(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = generateCorrelationId();

        if (ex instanceof org.springframework.web.ErrorResponse springError) {
            HttpStatus status = HttpStatus.valueOf(springError.getStatusCode().value());
            log.debug("[{}] Request rejected - Path: {} - Status: {}", correlationId, request.getRequestURI(), status);
            return buildResponse(status, ex.getMessage(), "REQUEST_REJECTED", correlationId, request);
        }

        log.error("[{}] Unexpected error occurred - Path: {} - Exception: {}",
                correlationId,
                request.getRequestURI(),
                ex.getMessage(),
                ex);

        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred. Please contact support if the problem persists.",
                "INTERNAL_SERVER_ERROR", correlationId, request);
    }
}

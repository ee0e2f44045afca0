package com.storefront.gateway.exception;

import com.storefront.common.dto.ErrorResponse;
import com.storefront.common.exception.MalformedUpstreamResponseException;
import com.storefront.common.exception.UpstreamUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.UUID;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private ResponseEntity<ErrorResponse> buildResponse(HttpStatusCode status, String detail, String errorCode,
                                                        String correlationId, HttpServletRequest request) {
        HttpStatus known = HttpStatus.resolve(status.value());
        ErrorResponse errorResponse = ErrorResponse.builder()
                .status(status.value())
                .error(known != null ? known.getReasonPhrase() : "HTTP " + status.value())
                .detail(detail)
                .path(request.getRequestURI())
                .timestamp(LocalDateTime.now())
                .errorCode(errorCode)
                .correlationId(correlationId)
                .build();

        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(UpstreamStatusException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamStatusException(
            UpstreamStatusException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatusCode.valueOf(ex.getStatus()), ex.getMessage(), "UPSTREAM_ERROR",
                UUID.randomUUID().toString(), request);
    }

    @ExceptionHandler(UpstreamUnavailableException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailableException(
            UpstreamUnavailableException ex,
            HttpServletRequest request) {

        String correlationId = UUID.randomUUID().toString();
        log.error("[{}] Orders service unavailable - Path: {}", correlationId, request.getRequestURI());

        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage(), "UPSTREAM_UNAVAILABLE",
                correlationId, request);
    }

    @ExceptionHandler(MalformedUpstreamResponseException.class)
    public ResponseEntity<ErrorResponse> handleMalformedUpstreamResponseException(
            MalformedUpstreamResponseException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_GATEWAY, ex.getMessage(), "MALFORMED_UPSTREAM_RESPONSE",
                UUID.randomUUID().toString(), request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatchException(
            MethodArgumentTypeMismatchException ex,
            HttpServletRequest request) {

        return buildResponse(HttpStatus.BAD_REQUEST,
                String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName()),
                "INVALID_ARGUMENT", UUID.randomUUID().toString(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGlobalException(
            Exception ex,
            HttpServletRequest request) {

        String correlationId = UUID.randomUUID().toString();

        if (ex instanceof org.springframework.web.ErrorResponse springError) {
            return buildResponse(springError.getStatusCode(), ex.getMessage(), "REQUEST_REJECTED",
                    correlationId, request);
        }

        log.error("[{}] Unexpected error while relaying to orders service - Path: {} - {}: {}",
                correlationId, request.getRequestURI(), ex.getClass().getSimpleName(), ex.getMessage(), ex);

        return buildResponse(HttpStatus.INTERNAL_SERVER_ERROR,
                "Unexpected error: " + ex.getClass().getSimpleName() + ": " + ex.getMessage(),
                "INTERNAL_SERVER_ERROR", correlationId, request);
    }
}

package com.rightsparser.exception;

import com.rightsparser.model.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Global exception handler for all REST controllers.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(ResourceNotFoundException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResourceNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
    }

    @ExceptionHandler(BadRequestException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleBadRequest(BadRequestException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage());
    }

    @ExceptionHandler(ServerWebInputException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleInput(ServerWebInputException ex) {
        log.warn("Invalid request input: {}", ex.getReason());
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex.getReason());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleValidationException(WebExchangeBindException ex) {
        String errors = ex.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        log.warn("Validation error: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "bad_request", "Validation failed: " + errors);
    }

    @ExceptionHandler(ApiKeyRejectedException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleApiKeyRejected(ApiKeyRejectedException ex) {
        log.warn("API key rejected ({}): {}", ex.getReason(), ex.getMessage());
        return respond(ex.getReason().getStatus(), ex.getReason().getKind(), ex.getMessage());
    }

    @ExceptionHandler(JobNotReadyException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleJobNotReady(JobNotReadyException ex) {
        return respond(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public Mono<ResponseEntity<ErrorResponse>> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal", "Internal server error: " + ex.getMessage());
    }

    public static ErrorResponse errorBody(String kind, String detail) {
        return ErrorResponse.builder()
                .error(kind)
                .detail(detail)
                .traceId(UUID.randomUUID().toString())
                .build();
    }

    private Mono<ResponseEntity<ErrorResponse>> respond(HttpStatus status, String kind, String detail) {
        return Mono.just(ResponseEntity.status(status).body(errorBody(kind, detail)));
    }
}

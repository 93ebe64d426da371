package com.feedsync.exception;

import com.feedsync.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler({AccountNotFoundException.class, ArticleNotFoundException.class, NoActiveSyncRunException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleNotFound(RuntimeException ex, ServerWebExchange exchange) {
        log.warn("Not found: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.NOT_FOUND, ex.getMessage(), exchange));
    }

    @ExceptionHandler({DuplicateAccountException.class, SyncAlreadyRunningException.class})
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleConflict(RuntimeException ex, ServerWebExchange exchange) {
        log.warn("Conflict: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.CONFLICT, ex.getMessage(), exchange));
    }

    @ExceptionHandler(FetchException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Mono<ErrorResponse> handleFetch(FetchException ex, ServerWebExchange exchange) {
        log.warn("Upstream failure: {}", ex.getMessage());
        return Mono.just(build(HttpStatus.BAD_GATEWAY, ex.getMessage(), exchange));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null ? fieldError.getDefaultMessage() : "invalid value",
                        (existing, duplicate) -> existing));
        log.warn("Validation failed: {}", errors);
        ErrorResponse response = build(HttpStatus.BAD_REQUEST, "Invalid request data", exchange);
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, ServerWebInputException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleBadRequest(Exception ex, ServerWebExchange exchange) {
        String message = ex instanceof ServerWebInputException input && input.getReason() != null
                ? input.getReason()
                : ex.getMessage();
        log.warn("Bad request: {}", message);
        return Mono.just(build(HttpStatus.BAD_REQUEST, message, exchange));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleUnexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}: {}", exchange.getRequest().getPath().value(), ex.getMessage(), ex);
        return Mono.just(build(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred", exchange));
    }

    private ErrorResponse build(HttpStatus status, String message, ServerWebExchange exchange) {
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(status.getReasonPhrase())
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .build();
    }
}

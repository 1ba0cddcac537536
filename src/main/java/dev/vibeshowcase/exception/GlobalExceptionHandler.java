package dev.vibeshowcase.exception;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@link ErrorResponse} bodies. Messages that are {@code messages.properties}
 * keys are translated; unexpected errors are logged in full and answered with a generic message.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final MessageSource messageSource;

    @ExceptionHandler(ResourceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Mono<ErrorResponse> handleResourceNotFound(ResourceNotFoundException ex, ServerWebExchange exchange) {
        log.warn("Resource not found: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.NOT_FOUND, "error.not_found", ex.getMessage()));
    }

    @ExceptionHandler(DuplicateResourceException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleDuplicateResource(DuplicateResourceException ex, ServerWebExchange exchange) {
        log.warn("Duplicate resource: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.CONFLICT, "error.conflict", ex.getMessage()));
    }

    // constraint races the services did not translate themselves
    @ExceptionHandler(DataIntegrityViolationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Mono<ErrorResponse> handleDataIntegrityViolation(DataIntegrityViolationException ex, ServerWebExchange exchange) {
        log.warn("Data integrity violation on {}: {}", exchange.getRequest().getPath().value(), ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.CONFLICT, "error.conflict", "error.concurrent_modification"));
    }

    @ExceptionHandler(AuthenticationException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Mono<ErrorResponse> handleAuthentication(AuthenticationException ex, ServerWebExchange exchange) {
        log.warn("Authentication failed: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.UNAUTHORIZED, "error.unauthorized", "error.invalid_credentials"));
    }

    @ExceptionHandler(AccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Mono<ErrorResponse> handleAccessDenied(AccessDeniedException ex, ServerWebExchange exchange) {
        log.warn("Access denied: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.FORBIDDEN, "error.forbidden", ex.getMessage()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleValidationErrors(WebExchangeBindException ex, ServerWebExchange exchange) {
        Locale locale = resolveLocale(exchange);
        Map<String, String> errors = ex.getBindingResult().getFieldErrors().stream()
                .collect(Collectors.toUnmodifiableMap(
                        FieldError::getField,
                        fieldError -> fieldError.getDefaultMessage() != null
                                ? fieldError.getDefaultMessage() : msg(locale, "error.invalid_value"),
                        (existing, duplicate) -> existing));

        log.warn("Validation failed: {}", errors);
        ErrorResponse response = build(exchange, HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_data");
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(jakarta.validation.ConstraintViolationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleConstraintViolation(
            jakarta.validation.ConstraintViolationException ex, ServerWebExchange exchange) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach(violation -> {
            String path = violation.getPropertyPath().toString();
            String field = path.contains(".") ? path.substring(path.lastIndexOf('.') + 1) : path;
            errors.put(field, violation.getMessage());
        });

        log.warn("Constraint violations: {}", errors);
        ErrorResponse response = build(exchange, HttpStatus.BAD_REQUEST, "error.validation_failed", "error.invalid_request_params");
        response.setValidationErrors(errors);
        return Mono.just(response);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex, ServerWebExchange exchange) {
        log.warn("Invalid argument: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_REQUEST, "error.bad_request",
                ex.getMessage() != null ? ex.getMessage() : "error.invalid_request"));
    }

    @ExceptionHandler(ServerWebInputException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Mono<ErrorResponse> handleServerWebInput(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Bad request input: {}", ex.getMessage());
        return Mono.just(build(exchange, HttpStatus.BAD_REQUEST, "error.bad_request", "error.invalid_request"));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public Mono<ResponseEntity<ErrorResponse>> handleResponseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        log.warn("Response status exception: {} - {}", ex.getStatusCode(), ex.getReason());
        HttpStatus status = HttpStatus.resolve(ex.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        String errorKey = statusToKey(status);
        return Mono.just(ResponseEntity.status(status)
                .body(build(exchange, status, errorKey, ex.getReason() != null ? ex.getReason() : errorKey)));
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Mono<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error on {}: ", exchange.getRequest().getPath().value(), ex);
        return Mono.just(build(exchange, HttpStatus.INTERNAL_SERVER_ERROR,
                "error.internal_server_error", "error.unexpected_error"));
    }

    private ErrorResponse build(ServerWebExchange exchange, HttpStatus status, String errorKey, String messageKey) {
        Locale locale = resolveLocale(exchange);
        return ErrorResponse.builder()
                .timestamp(LocalDateTime.now())
                .status(status.value())
                .error(msg(locale, errorKey))
                .message(msg(locale, messageKey))
                .path(exchange.getRequest().getPath().value())
                .build();
    }

    private Locale resolveLocale(ServerWebExchange exchange) {
        Locale locale = exchange.getLocaleContext().getLocale();
        return locale != null ? locale : Locale.ENGLISH;
    }

    // unknown codes come back unchanged
    private String msg(Locale locale, String code) {
        return messageSource.getMessage(code, null, code, locale);
    }

    private String statusToKey(HttpStatus status) {
        return switch (status) {
            case NOT_FOUND -> "error.not_found";
            case UNAUTHORIZED -> "error.unauthorized";
            case FORBIDDEN -> "error.forbidden";
            case CONFLICT -> "error.conflict";
            case BAD_REQUEST -> "error.bad_request";
            default -> "error.internal_server_error";
        };
    }
}

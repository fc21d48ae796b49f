package com.github.dimitryivaniuta.keyguard.web;

import com.github.dimitryivaniuta.keyguard.lifecycle.IllegalKeyTransitionException;
import com.github.dimitryivaniuta.keyguard.lifecycle.KeyConflictException;
import com.github.dimitryivaniuta.keyguard.lifecycle.UnknownKeyException;
import com.github.dimitryivaniuta.keyguard.store.StoreUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

import static com.github.dimitryivaniuta.keyguard.web.RequestContextKeys.CORRELATION_ID_MDC_KEY;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public record ApiError(
            Instant timestamp,
            int status,
            String error,
            String message,
            String path,
            String correlationId
    ) {
        static ApiError of(HttpStatus status, String message, String path) {
            return new ApiError(
                    Instant.now(),
                    status.value(),
                    status.getReasonPhrase(),
                    (message == null || message.isBlank()) ? status.getReasonPhrase() : message,
                    path,
                    MDC.get(CORRELATION_ID_MDC_KEY)
            );
        }
    }

    @ExceptionHandler(UnknownKeyException.class)
    public ResponseEntity<ApiError> handleUnknownKey(UnknownKeyException ex, HttpServletRequest req) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), req);
    }

    @ExceptionHandler({KeyConflictException.class, IllegalKeyTransitionException.class})
    public ResponseEntity<ApiError> handleConflict(RuntimeException ex, HttpServletRequest req) {
        log.info("Key operation rejected: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), req);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ApiError> handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest req) {
        log.warn("Key store unavailable: {}", ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "store_unavailable", req);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleRse(ResponseStatusException ex, HttpServletRequest req) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        return respond(status, ex.getReason(), req);
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, BindException.class, ConstraintViolationException.class})
    public ResponseEntity<ApiError> handleValidation(Exception ex, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, "Validation failed", req);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex, HttpServletRequest req) {
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), req);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> noResource(NoResourceFoundException ex, HttpServletRequest req) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), req);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest req) {
        log.error("Unhandled exception", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", req);
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, String message, HttpServletRequest req) {
        return ResponseEntity.status(status).body(ApiError.of(status, message, req.getRequestURI()));
    }
}

package com.geofencing.subscriptions.exception;

import com.geofencing.subscriptions.dto.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps exceptions to the error body {status, code, message}.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(GeofencingApiException.class)
    public ResponseEntity<ErrorResponse> handleGeofencingApiException(GeofencingApiException e) {
        log.warn("Request rejected: code={}, message={}", e.getErrorCode().getCode(), e.getMessage());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSubscriptionNotFound(SubscriptionNotFoundException e) {
        log.debug("Subscription {} not found", e.getSubscriptionId());
        return toResponse(e.getErrorCode(), e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        log.warn("Validation failed: {}", message);
        return toResponse(ApiErrorCode.INVALID_ARGUMENT, message.isEmpty() ? "Validation failed" : message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMessage());
        return toResponse(ApiErrorCode.INVALID_ARGUMENT, "Malformed request body");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        // Framework errors (unknown path, wrong method, ...) keep their own status
        if (e instanceof org.springframework.web.ErrorResponse frameworkError) {
            HttpStatusCode status = frameworkError.getStatusCode();
            String code = status instanceof HttpStatus httpStatus ? httpStatus.name() : String.valueOf(status.value());
            log.warn("Request failed with status {}: {}", status.value(), e.getMessage());
            return ResponseEntity.status(status)
                .body(new ErrorResponse(status.value(), code, e.getMessage()));
        }

        log.error("Unexpected error: {}", e.getMessage(), e);
        return toResponse(ApiErrorCode.INTERNAL, "An unexpected error occurred");
    }

    private static ResponseEntity<ErrorResponse> toResponse(ApiErrorCode errorCode, String message) {
        ErrorResponse body = new ErrorResponse(errorCode.getStatus().value(), errorCode.getCode(), message);
        return ResponseEntity.status(errorCode.getStatus()).body(body);
    }

    private static String describe(FieldError error) {
        return error.getField() + ": " + error.getDefaultMessage();
    }
}

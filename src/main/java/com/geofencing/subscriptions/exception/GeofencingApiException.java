package com.geofencing.subscriptions.exception;

/**
 * Exception thrown when a request cannot be fulfilled, carrying the API error code
 * that the caller receives.
 *
 * Validation failures are thrown before anything is stored, so a rejected request
 * never leaves a partial subscription behind.
 */
public class GeofencingApiException extends RuntimeException {

    private final ApiErrorCode errorCode;

    public GeofencingApiException(ApiErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ApiErrorCode getErrorCode() {
        return errorCode;
    }
}

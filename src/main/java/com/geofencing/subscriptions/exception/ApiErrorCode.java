package com.geofencing.subscriptions.exception;

import org.springframework.http.HttpStatus;

/**
 * Machine-readable error codes returned by the APIs, with their HTTP status.
 */
public enum ApiErrorCode {
    INVALID_ARGUMENT(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT"),
    INVALID_PROTOCOL(HttpStatus.BAD_REQUEST, "INVALID_PROTOCOL"),
    NOT_FOUND(HttpStatus.NOT_FOUND, "NOT_FOUND"),
    MISSING_IDENTIFIER(HttpStatus.UNPROCESSABLE_ENTITY, "MISSING_IDENTIFIER"),
    MULTIEVENT_SUBSCRIPTION_NOT_SUPPORTED(HttpStatus.UNPROCESSABLE_ENTITY, "MULTIEVENT_SUBSCRIPTION_NOT_SUPPORTED"),

    SUBSCRIPTION_AREA_NOT_COVERED(HttpStatus.UNPROCESSABLE_ENTITY, "GEOFENCING_SUBSCRIPTIONS.AREA_NOT_COVERED"),
    SUBSCRIPTION_INVALID_AREA(HttpStatus.UNPROCESSABLE_ENTITY, "GEOFENCING_SUBSCRIPTIONS.INVALID_AREA"),

    VERIFICATION_AREA_NOT_COVERED(HttpStatus.UNPROCESSABLE_ENTITY, "LOCATION_VERIFICATION.AREA_NOT_COVERED"),
    VERIFICATION_INVALID_AREA(HttpStatus.UNPROCESSABLE_ENTITY, "LOCATION_VERIFICATION.INVALID_AREA"),

    RETRIEVAL_UNABLE_TO_FULFILL_MAX_AGE(HttpStatus.UNPROCESSABLE_ENTITY, "LOCATION_RETRIEVAL.UNABLE_TO_FULFILL_MAX_AGE"),
    RETRIEVAL_UNABLE_TO_FULFILL_MAX_SURFACE(HttpStatus.UNPROCESSABLE_ENTITY, "LOCATION_RETRIEVAL.UNABLE_TO_FULFILL_MAX_SURFACE"),
    RETRIEVAL_DEVICE_NOT_FOUND(HttpStatus.NOT_FOUND, "LOCATION_RETRIEVAL.DEVICE_NOT_FOUND"),

    INTERNAL(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL");

    private final HttpStatus status;
    private final String code;

    ApiErrorCode(HttpStatus status, String code) {
        this.status = status;
        this.code = code;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getCode() {
        return code;
    }
}

package com.geofencing.subscriptions.dto;

/**
 * Error body returned by every API of this service.
 *
 * @param status  HTTP status code
 * @param code    Machine-readable error code, e.g. "GEOFENCING_SUBSCRIPTIONS.INVALID_AREA"
 * @param message Human-readable description
 */
public record ErrorResponse(
    int status,
    String code,
    String message
) {
}

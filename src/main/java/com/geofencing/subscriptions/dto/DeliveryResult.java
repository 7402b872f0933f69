package com.geofencing.subscriptions.dto;

/**
 * Outcome of a single webhook POST.
 *
 * @param sent       Whether the sink accepted the event with a 2xx response
 * @param statusCode HTTP status returned by the sink, null when no response was received
 * @param error      Failure description, null on success
 */
public record DeliveryResult(
    boolean sent,
    Integer statusCode,
    String error
) {

    public static DeliveryResult delivered(int statusCode) {
        return new DeliveryResult(true, statusCode, null);
    }

    public static DeliveryResult rejected(int statusCode, String error) {
        return new DeliveryResult(false, statusCode, error);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, null, error);
    }
}

package com.geofencing.subscriptions.exception;

/**
 * Transient failure of the position source (network error, timeout, rejected credentials).
 *
 * The monitor treats it as "try again next pass"; the verification API reports UNKNOWN.
 */
public class PositionUnavailableException extends RuntimeException {

    public PositionUnavailableException(String message) {
        super(message);
    }

    public PositionUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

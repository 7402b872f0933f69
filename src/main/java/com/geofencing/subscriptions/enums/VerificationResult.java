package com.geofencing.subscriptions.enums;

/**
 * Outcome of a synchronous location verification.
 * UNKNOWN means the device position could not be obtained.
 */
public enum VerificationResult {
    TRUE,
    FALSE,
    UNKNOWN
}

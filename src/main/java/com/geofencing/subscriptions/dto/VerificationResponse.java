package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geofencing.subscriptions.enums.VerificationResult;

/**
 * Result of a location verification.
 *
 * @param verificationResult TRUE, FALSE or UNKNOWN
 * @param lastLocationTime   Time of the position used, absent for UNKNOWN
 * @param distance           Distance in meters from the device to the area center, absent for UNKNOWN
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerificationResponse(
    VerificationResult verificationResult,
    String lastLocationTime,
    Double distance
) {

    public static VerificationResponse unknown() {
        return new VerificationResponse(VerificationResult.UNKNOWN, null, null);
    }
}

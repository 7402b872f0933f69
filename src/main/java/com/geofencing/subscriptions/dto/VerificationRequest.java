package com.geofencing.subscriptions.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * Body of a location verification request.
 *
 * @param device Device to verify
 * @param area   Circle to verify against
 * @param maxAge Maximum acceptable age of the position in seconds (accepted, not enforced)
 */
public record VerificationRequest(
    @NotNull(message = "Device is required")
    @Valid
    DeviceRecord device,

    @NotNull(message = "Area is required")
    @Valid
    AreaRecord area,

    Integer maxAge
) {
}

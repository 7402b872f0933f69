package com.geofencing.subscriptions.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

/**
 * What a subscription watches: one device and one area.
 */
public record SubscriptionDetailRecord(
    @Valid
    DeviceRecord device,

    @NotNull(message = "Area is required")
    @Valid
    AreaRecord area
) {
}

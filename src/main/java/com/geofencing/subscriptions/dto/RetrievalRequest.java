package com.geofencing.subscriptions.dto;

import jakarta.validation.Valid;

/**
 * Body of a location retrieval request.
 *
 * @param device     Device to locate
 * @param maxAge     Maximum acceptable age of the position in seconds
 * @param maxSurface Maximum acceptable surface of the returned area (not supported)
 */
public record RetrievalRequest(
    @Valid
    DeviceRecord device,

    Integer maxAge,

    Integer maxSurface
) {
}

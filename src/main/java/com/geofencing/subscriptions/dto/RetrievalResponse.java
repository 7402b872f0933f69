package com.geofencing.subscriptions.dto;

/**
 * Location of a device, expressed as a circle around the last known position.
 */
public record RetrievalResponse(
    String lastLocationTime,
    AreaRecord area
) {
}

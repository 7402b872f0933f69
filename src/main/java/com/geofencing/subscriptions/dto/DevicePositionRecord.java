package com.geofencing.subscriptions.dto;

import java.time.Instant;

/**
 * Last known position of a device, as reported by the position source.
 *
 * @param latitude   Latitude in decimal degrees
 * @param longitude  Longitude in decimal degrees
 * @param observedAt When the position was observed
 */
public record DevicePositionRecord(
    double latitude,
    double longitude,
    Instant observedAt
) {

    public PointRecord toPoint() {
        return PointRecord.of(latitude, longitude);
    }
}

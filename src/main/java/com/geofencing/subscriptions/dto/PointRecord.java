package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;

/**
 * A WGS84 coordinate.
 *
 * Both fields are nullable at the binding level; a missing center coordinate is
 * reported by the services with an API-specific INVALID_AREA code.
 *
 * @param latitude  Latitude in decimal degrees
 * @param longitude Longitude in decimal degrees
 */
public record PointRecord(
    @DecimalMin(value = "-90.0", message = "Latitude must be >= -90")
    @DecimalMax(value = "90.0", message = "Latitude must be <= 90")
    Double latitude,

    @DecimalMin(value = "-180.0", message = "Longitude must be >= -180")
    @DecimalMax(value = "180.0", message = "Longitude must be <= 180")
    Double longitude
) {

    public static PointRecord of(double latitude, double longitude) {
        return new PointRecord(latitude, longitude);
    }

    @JsonIgnore
    public boolean isComplete() {
        return latitude != null && longitude != null;
    }

    public String toLogString() {
        return String.format("(%.6f, %.6f)", latitude, longitude);
    }
}

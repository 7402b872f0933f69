package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;

/**
 * Geographic area of a subscription or verification request.
 *
 * Only circles are supported. The area type is kept as a raw string so that an
 * unsupported type can be rejected with AREA_NOT_COVERED rather than a parse error.
 *
 * @param areaType "CIRCLE"
 * @param center   Circle center
 * @param radius   Circle radius in meters
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AreaRecord(
    String areaType,

    @Valid
    PointRecord center,

    Double radius
) {

    public static final String CIRCLE = "CIRCLE";

    public static AreaRecord circle(PointRecord center, double radius) {
        return new AreaRecord(CIRCLE, center, radius);
    }

    @JsonIgnore
    public boolean isCircle() {
        return CIRCLE.equalsIgnoreCase(areaType);
    }

    @JsonIgnore
    public boolean hasCenter() {
        return center != null && center.isComplete();
    }

    public String toLogString() {
        return String.format("Circle[center=%s, radius=%.1fm]",
            center != null ? center.toLogString() : "?", radius);
    }
}

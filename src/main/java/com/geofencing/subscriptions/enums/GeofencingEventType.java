package com.geofencing.subscriptions.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * CloudEvent types emitted by the geofencing engine.
 *
 * AREA_ENTERED and AREA_LEFT are the only types a subscription can be created for.
 * SUBSCRIPTION_ENDS is emitted by the engine itself when a subscription terminates.
 */
public enum GeofencingEventType {
    AREA_ENTERED("area-entered"),
    AREA_LEFT("area-left"),
    SUBSCRIPTION_ENDS("subscription-ends");

    public static final String NAMESPACE = "org.camaraproject.geofencing-subscriptions.v0";

    private final String shortName;

    GeofencingEventType(String shortName) {
        this.shortName = shortName;
    }

    public String getShortName() {
        return shortName;
    }

    /**
     * Fully qualified type, e.g. "org.camaraproject.geofencing-subscriptions.v0.area-entered".
     */
    public String getType() {
        return NAMESPACE + "." + shortName;
    }

    public boolean isAreaEvent() {
        return this != SUBSCRIPTION_ENDS;
    }

    /**
     * Whether a device classified as {@code classification} satisfies this event type.
     */
    public boolean matches(Classification classification) {
        return switch (this) {
            case AREA_ENTERED -> classification == Classification.INSIDE;
            case AREA_LEFT -> classification == Classification.OUTSIDE;
            case SUBSCRIPTION_ENDS -> false;
        };
    }

    public static Optional<GeofencingEventType> fromType(String type) {
        return Arrays.stream(values())
                .filter(value -> value.getType().equals(type))
                .findFirst();
    }
}

package com.geofencing.subscriptions.enums;

/**
 * Current belief about where a subscription's device is relative to its area.
 */
public enum Classification {
    UNKNOWN,
    INSIDE,
    OUTSIDE;

    public static Classification of(boolean inside) {
        return inside ? INSIDE : OUTSIDE;
    }
}

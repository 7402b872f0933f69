package com.geofencing.subscriptions.enums;

/**
 * Reason carried by a "subscription-ends" notification.
 */
public enum TerminationReason {
    SUBSCRIPTION_EXPIRED,
    MAX_EVENTS_REACHED,
    SUBSCRIPTION_DELETED
}

package com.geofencing.subscriptions.enums;

/**
 * Subscription status. EXPIRED is terminal.
 */
public enum SubscriptionStatus {
    ACTIVE,
    EXPIRED
}

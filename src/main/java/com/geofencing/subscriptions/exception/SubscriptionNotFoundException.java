package com.geofencing.subscriptions.exception;

/**
 * Thrown when a subscription id is not (or no longer) in the store.
 */
public class SubscriptionNotFoundException extends GeofencingApiException {

    private final String subscriptionId;

    public SubscriptionNotFoundException(String subscriptionId) {
        super(ApiErrorCode.NOT_FOUND, "Subscription not found");
        this.subscriptionId = subscriptionId;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }
}

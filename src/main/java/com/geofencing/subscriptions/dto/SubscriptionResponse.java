package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.enums.SubscriptionStatus;

import java.util.List;

/**
 * Subscription as returned by the management API.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionResponse(
    String protocol,
    String sink,
    List<String> types,
    SubscriptionConfigRecord config,
    String id,
    String startsAt,
    SubscriptionStatus status,
    String expiresAt
) {

    public static SubscriptionResponse from(Subscription subscription) {
        String expiresAt = subscription.getExpiresAt() != null ? subscription.getExpiresAt().toString() : null;

        SubscriptionConfigRecord config = new SubscriptionConfigRecord(
            new SubscriptionDetailRecord(subscription.getDevice(), subscription.getArea()),
            subscription.isInitialEvent(),
            subscription.getMaxEvents(),
            expiresAt
        );

        return new SubscriptionResponse(
            subscription.getProtocol(),
            subscription.getSink(),
            List.of(subscription.getEventType().getType()),
            config,
            subscription.getId(),
            subscription.getStartsAt().toString(),
            subscription.getStatus(),
            expiresAt
        );
    }
}

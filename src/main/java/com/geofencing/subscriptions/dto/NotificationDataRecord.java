package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geofencing.subscriptions.enums.TerminationReason;

/**
 * Domain payload of a geofencing CloudEvent.
 *
 * @param subscriptionId    Subscription that produced the event
 * @param device            Device of the subscription
 * @param area              Area of the subscription
 * @param terminationReason Only set on "subscription-ends" events
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NotificationDataRecord(
    String subscriptionId,
    DeviceRecord device,
    AreaRecord area,
    TerminationReason terminationReason
) {
}

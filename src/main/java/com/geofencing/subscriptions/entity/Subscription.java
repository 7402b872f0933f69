package com.geofencing.subscriptions.entity;

import com.geofencing.subscriptions.dto.AreaRecord;
import com.geofencing.subscriptions.dto.DeviceRecord;
import com.geofencing.subscriptions.enums.GeofencingEventType;
import com.geofencing.subscriptions.enums.SubscriptionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A client's standing request to be notified about one device/area/event-type relationship.
 *
 * Design:
 * - Immutable: the store hands out the same instance to the monitor and to API callers
 * - Status changes produce a copy (see {@link #withStatus})
 * - Runtime classification and counters live in {@link SubscriptionRuntimeState}, next to
 *   this value in the same store entry
 */
@Value
@Builder(toBuilder = true)
public class Subscription {

    String id;

    /**
     * Delivery protocol, always "HTTP".
     */
    String protocol;

    /**
     * Callback URL receiving the CloudEvents.
     */
    String sink;

    /**
     * The single area event type this subscription notifies about.
     */
    GeofencingEventType eventType;

    DeviceRecord device;

    /**
     * Circle with a radius of at least the configured minimum.
     */
    AreaRecord area;

    boolean initialEvent;

    /**
     * Optional cap on the number of area notifications.
     */
    Integer maxEvents;

    /**
     * Optional instant after which the subscription ends.
     */
    Instant expiresAt;

    SubscriptionStatus status;

    Instant startsAt;

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean hasReachedQuota(int eventsSent) {
        return maxEvents != null && eventsSent >= maxEvents;
    }

    public Subscription withStatus(SubscriptionStatus newStatus) {
        return toBuilder().status(newStatus).build();
    }

    public String toLogString() {
        return String.format("Subscription[id=%s, type=%s, device=%s, area=%s]",
            id, eventType.getShortName(), device.positionIdentifier(), area.toLogString());
    }
}

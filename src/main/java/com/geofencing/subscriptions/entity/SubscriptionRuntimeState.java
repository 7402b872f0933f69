package com.geofencing.subscriptions.entity;

import com.geofencing.subscriptions.enums.Classification;
import com.geofencing.subscriptions.enums.GeofencingEventType;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Per-subscription state owned by the monitor.
 *
 * State Machine (classification):
 * - UNKNOWN -> INSIDE/OUTSIDE on the first successful evaluation; notifies only when
 *   initialEvent is set and the new classification matches the event type
 * - OUTSIDE -> INSIDE notifies "area-entered" subscriptions
 * - INSIDE -> OUTSIDE notifies "area-left" subscriptions
 * - Any other change is applied silently; no change never notifies
 *
 * Instances are mutated only under the lock of their store entry.
 */
@Getter
@ToString
public class SubscriptionRuntimeState {

    private Classification classification = Classification.UNKNOWN;

    private int eventsSent;

    private Double lastDistanceMeters;

    private Instant lastEvaluatedAt;

    /**
     * Whether an observation would produce a notification, without changing any state.
     */
    public boolean wouldNotify(boolean inside, GeofencingEventType eventType, boolean initialEvent) {
        Classification previous = classification == null ? Classification.UNKNOWN : classification;
        Classification next = Classification.of(inside);

        if (previous == Classification.UNKNOWN) {
            return initialEvent && eventType.matches(next);
        }
        return previous != next && eventType.matches(next);
    }

    /**
     * Records a position evaluation and advances the classification.
     *
     * @param inside       Whether the device is inside the area
     * @param distance     Distance from the device to the area center in meters
     * @param eventType    The subscription's event type
     * @param initialEvent Whether the first evaluation may notify
     * @param at           Evaluation time
     * @return true if this evaluation must produce a notification
     */
    public boolean recordObservation(
        boolean inside,
        double distance,
        GeofencingEventType eventType,
        boolean initialEvent,
        Instant at
    ) {
        boolean notify = wouldNotify(inside, eventType, initialEvent);

        classification = Classification.of(inside);
        lastDistanceMeters = distance;
        lastEvaluatedAt = at;

        return notify;
    }

    public void recordEventSent() {
        eventsSent++;
    }

    /**
     * Detached copy for readers outside the entry lock.
     */
    public SubscriptionRuntimeState copy() {
        SubscriptionRuntimeState copy = new SubscriptionRuntimeState();
        copy.classification = classification;
        copy.eventsSent = eventsSent;
        copy.lastDistanceMeters = lastDistanceMeters;
        copy.lastEvaluatedAt = lastEvaluatedAt;
        return copy;
    }
}

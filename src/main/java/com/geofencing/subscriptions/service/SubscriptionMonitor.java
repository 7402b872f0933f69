package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.config.GeofencingProperties;
import com.geofencing.subscriptions.dto.AreaRecord;
import com.geofencing.subscriptions.dto.DevicePositionRecord;
import com.geofencing.subscriptions.dto.MonitorPassSummary;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.entity.SubscriptionRuntimeState;
import com.geofencing.subscriptions.enums.TerminationReason;
import com.geofencing.subscriptions.exception.PositionUnavailableException;
import com.geofencing.subscriptions.repository.SubscriptionStore;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background monitor driving the geofencing state machine.
 *
 * This is the heart of the engine. Every pass walks a snapshot of the store and, for
 * each subscription, in order:
 * 1. Expiry: ends the subscription with SUBSCRIPTION_EXPIRED once expiresAt is reached
 * 2. Quota: ends the subscription with MAX_EVENTS_REACHED once maxEvents were sent
 * 3. Position: asks the position provider; no identifier, unknown device or a transient
 *    failure skips the subscription until the next pass
 * 4. Classification: inside when the haversine distance is within the radius
 * 5. Transition: advances the runtime state and notifies on a matching transition
 *
 * Failure Isolation:
 * - An exception while evaluating one subscription is logged and the pass continues
 * - Position lookups are bounded by the NEF client timeout
 * - Notifications are handed to the notification executor, so a slow sink does not
 *   hold up the pass
 *
 * Consistency:
 * The transition, the notification and the counter increment happen under the store
 * entry lock and only while the subscription is still stored. A subscription deleted
 * while its position was being fetched is never notified or brought back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionMonitor {

    private final SubscriptionStore subscriptionStore;
    private final SubscriptionLifecycleService lifecycleService;
    private final NotificationDispatcher notificationDispatcher;
    private final PositionProvider positionProvider;
    private final GeofencingProperties properties;

    private final AtomicBoolean stopping = new AtomicBoolean(false);

    /**
     * Scheduled entry point, run with a fixed delay between passes (3 seconds by default).
     */
    @Scheduled(fixedDelayString = "${geofencing.monitor.interval:PT3S}",
               initialDelayString = "${geofencing.monitor.initial-delay:PT3S}")
    public void scheduledPass() {
        if (!properties.getMonitor().isEnabled() || stopping.get()) {
            return;
        }

        MonitorPassSummary summary = runPass();
        if (summary.scanned() > 0) {
            log.debug("Monitor pass completed: {}", summary.toLogString());
        }
    }

    /**
     * Runs one full pass over all stored subscriptions.
     */
    public MonitorPassSummary runPass() {
        List<Subscription> snapshot = subscriptionStore.findAll();
        PassCounters counters = new PassCounters();

        for (Subscription subscription : snapshot) {
            if (stopping.get() || Thread.currentThread().isInterrupted()) {
                log.info("Monitor stopping, pass interrupted");
                break;
            }

            try {
                evaluate(subscription, counters);
            } catch (Exception e) {
                counters.failed++;
                log.error("Failed to evaluate subscription {}", subscription.getId(), e);
            }
        }

        return counters.toSummary(snapshot.size());
    }

    /**
     * Stops starting new passes and cuts the running pass short.
     */
    @PreDestroy
    public void stop() {
        if (stopping.compareAndSet(false, true)) {
            log.info("Subscription monitor shutting down");
        }
    }

    public boolean isStopping() {
        return stopping.get();
    }

    private void evaluate(Subscription subscription, PassCounters counters) {
        String id = subscription.getId();
        Instant now = Instant.now();

        if (subscription.isExpiredAt(now)) {
            terminate(id, TerminationReason.SUBSCRIPTION_EXPIRED, counters);
            return;
        }

        Optional<SubscriptionRuntimeState> state = subscriptionStore.findState(id);
        if (state.isEmpty()) {
            // Deleted since the snapshot was taken
            counters.skipped++;
            return;
        }

        if (subscription.hasReachedQuota(state.get().getEventsSent())) {
            terminate(id, TerminationReason.MAX_EVENTS_REACHED, counters);
            return;
        }

        String deviceId = subscription.getDevice().positionIdentifier();
        if (deviceId == null) {
            log.debug("Subscription {} has no locatable device identifier, skipping", id);
            counters.skipped++;
            return;
        }

        Optional<DevicePositionRecord> position;
        try {
            position = positionProvider.getPosition(deviceId);
        } catch (PositionUnavailableException e) {
            log.debug("Position of {} unavailable, retrying next pass: {}", deviceId, e.getMessage());
            counters.skipped++;
            return;
        }

        if (position.isEmpty()) {
            log.debug("No position for device {}, retrying next pass", deviceId);
            counters.skipped++;
            return;
        }

        AreaRecord area = subscription.getArea();
        double distance = AreaMath.distanceMeters(position.get().toPoint(), area.center());
        boolean inside = distance <= area.radius();

        Optional<Observation> observation = subscriptionStore.update(id, runtimeState -> {
            boolean notify = runtimeState.wouldNotify(inside, subscription.getEventType(), subscription.isInitialEvent());
            if (notify) {
                // State only advances once the event was handed off
                notificationDispatcher.notify(subscription, subscription.getEventType(), null);
            }
            runtimeState.recordObservation(
                inside, distance, subscription.getEventType(), subscription.isInitialEvent(), now);
            if (notify) {
                runtimeState.recordEventSent();
            }
            return new Observation(notify, runtimeState.getEventsSent());
        });

        if (observation.isEmpty()) {
            counters.skipped++;
            return;
        }

        if (observation.get().notified()) {
            counters.notified++;
            log.info("Device {} triggered {} for subscription {} (distance {}m)",
                deviceId, subscription.getEventType().getShortName(), id, String.format("%.2f", distance));

            if (subscription.hasReachedQuota(observation.get().eventsSent())) {
                terminate(id, TerminationReason.MAX_EVENTS_REACHED, counters);
            }
        }
    }

    private void terminate(String id, TerminationReason reason, PassCounters counters) {
        if (lifecycleService.terminate(id, reason)) {
            counters.terminated++;
        } else {
            counters.skipped++;
        }
    }

    private record Observation(boolean notified, int eventsSent) {
    }

    private static final class PassCounters {

        private int notified;
        private int terminated;
        private int skipped;
        private int failed;

        private MonitorPassSummary toSummary(int scanned) {
            return new MonitorPassSummary(scanned, notified, terminated, skipped, failed);
        }
    }
}

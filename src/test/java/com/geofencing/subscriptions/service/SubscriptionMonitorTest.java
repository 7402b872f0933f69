package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.config.GeofencingProperties;
import com.geofencing.subscriptions.dto.DeliveryResult;
import com.geofencing.subscriptions.dto.DevicePositionRecord;
import com.geofencing.subscriptions.dto.DeviceRecord;
import com.geofencing.subscriptions.dto.MonitorPassSummary;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.entity.SubscriptionRuntimeState;
import com.geofencing.subscriptions.enums.Classification;
import com.geofencing.subscriptions.exception.PositionUnavailableException;
import com.geofencing.subscriptions.repository.SubscriptionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static com.geofencing.subscriptions.TestSubscriptions.DEVICE_ID;
import static com.geofencing.subscriptions.TestSubscriptions.subscription;
import static com.geofencing.subscriptions.enums.GeofencingEventType.AREA_ENTERED;
import static com.geofencing.subscriptions.enums.GeofencingEventType.AREA_LEFT;
import static com.geofencing.subscriptions.enums.GeofencingEventType.SUBSCRIPTION_ENDS;
import static com.geofencing.subscriptions.enums.TerminationReason.MAX_EVENTS_REACHED;
import static com.geofencing.subscriptions.enums.TerminationReason.SUBSCRIPTION_DELETED;
import static com.geofencing.subscriptions.enums.TerminationReason.SUBSCRIPTION_EXPIRED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriptionMonitorTest {

    private static final DevicePositionRecord INSIDE = new DevicePositionRecord(0.001, 0.001, Instant.now());
    private static final DevicePositionRecord OUTSIDE = new DevicePositionRecord(1.0, 1.0, Instant.now());

    @Mock
    private NotificationDispatcher notificationDispatcher;

    private FakePositionProvider positionProvider;
    private SubscriptionStore subscriptionStore;
    private SubscriptionLifecycleService lifecycleService;
    private SubscriptionMonitor monitor;

    @BeforeEach
    void setUp() {
        GeofencingProperties properties = new GeofencingProperties();
        positionProvider = new FakePositionProvider();
        subscriptionStore = new SubscriptionStore();
        lifecycleService = new SubscriptionLifecycleService(subscriptionStore, notificationDispatcher, properties);
        monitor = new SubscriptionMonitor(subscriptionStore, lifecycleService, notificationDispatcher, positionProvider, properties);
    }

    @Test
    void shouldSendInitialEventWhenAlreadyInside() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).initialEvent(true).build());
        positionProvider.place(DEVICE_ID, INSIDE);

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.notified()).isEqualTo(1);
        verify(notificationDispatcher).notify(eq(sub), eq(AREA_ENTERED), isNull());
        assertThat(state(sub).getEventsSent()).isEqualTo(1);

        monitor.runPass();

        verify(notificationDispatcher, times(1)).notify(any(), any(), any());
    }

    @Test
    void shouldNotNotifyFirstEvaluationWithoutInitialEvent() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).build());
        positionProvider.place(DEVICE_ID, INSIDE);

        monitor.runPass();

        verifyNoInteractions(notificationDispatcher);
        assertThat(state(sub).getClassification()).isEqualTo(Classification.INSIDE);
    }

    @Test
    void shouldNotifyEachEntryWhenOscillating() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).build());

        for (DevicePositionRecord position : new DevicePositionRecord[]{OUTSIDE, INSIDE, OUTSIDE, INSIDE}) {
            positionProvider.place(DEVICE_ID, position);
            monitor.runPass();
        }

        verify(notificationDispatcher, times(2)).notify(eq(sub), eq(AREA_ENTERED), isNull());
        assertThat(state(sub).getEventsSent()).isEqualTo(2);
    }

    @Test
    void shouldIgnoreStayingInsideForAreaLeft() {
        Subscription sub = subscriptionStore.save(subscription(AREA_LEFT).initialEvent(true).build());
        positionProvider.place(DEVICE_ID, INSIDE);

        monitor.runPass();
        monitor.runPass();

        verifyNoInteractions(notificationDispatcher);

        positionProvider.place(DEVICE_ID, OUTSIDE);
        monitor.runPass();

        verify(notificationDispatcher).notify(eq(sub), eq(AREA_LEFT), isNull());
        assertThat(state(sub).getClassification()).isEqualTo(Classification.OUTSIDE);
    }

    @Test
    void shouldEndExpiredSubscriptionWithoutLookup() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED)
                .expiresAt(Instant.now().minusSeconds(1))
                .build());
        positionProvider.place(DEVICE_ID, INSIDE);

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.terminated()).isEqualTo(1);
        verify(notificationDispatcher).notify(argThat(s -> s.getId().equals(sub.getId())),
                eq(SUBSCRIPTION_ENDS), eq(SUBSCRIPTION_EXPIRED));
        assertThat(subscriptionStore.findById(sub.getId())).isEmpty();
        assertThat(lifecycleService.list()).isEmpty();
        assertThat(positionProvider.lookups.get()).isZero();
    }

    @Test
    void shouldEndSubscriptionInSamePassWhenQuotaReached() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED)
                .initialEvent(true)
                .maxEvents(1)
                .build());
        positionProvider.place(DEVICE_ID, INSIDE);

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.notified()).isEqualTo(1);
        assertThat(summary.terminated()).isEqualTo(1);
        InOrder order = inOrder(notificationDispatcher);
        order.verify(notificationDispatcher).notify(eq(sub), eq(AREA_ENTERED), isNull());
        order.verify(notificationDispatcher).notify(argThat(s -> s.getId().equals(sub.getId())),
                eq(SUBSCRIPTION_ENDS), eq(MAX_EVENTS_REACHED));
        assertThat(subscriptionStore.findById(sub.getId())).isEmpty();
    }

    @Test
    void shouldSkipOnTransientFailureAndRecover() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).build());
        positionProvider.place(DEVICE_ID, OUTSIDE);
        monitor.runPass();

        positionProvider.unavailable.add(DEVICE_ID);
        MonitorPassSummary failedPass = monitor.runPass();

        assertThat(failedPass.skipped()).isEqualTo(1);
        assertThat(failedPass.failed()).isZero();
        assertThat(state(sub).getClassification()).isEqualTo(Classification.OUTSIDE);

        positionProvider.unavailable.clear();
        positionProvider.place(DEVICE_ID, INSIDE);
        monitor.runPass();

        verify(notificationDispatcher).notify(eq(sub), eq(AREA_ENTERED), isNull());
    }

    @Test
    void shouldSkipDeviceWithoutPosition() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).initialEvent(true).build());

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(state(sub).getClassification()).isEqualTo(Classification.UNKNOWN);
        verifyNoInteractions(notificationDispatcher);
    }

    @Test
    void shouldSkipDeviceWithoutLocatableIdentifier() {
        subscriptionStore.save(subscription(AREA_ENTERED)
                .device(new DeviceRecord(null, "+306912345678", null, null, null))
                .build());

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.skipped()).isEqualTo(1);
        assertThat(positionProvider.lookups.get()).isZero();
    }

    @Test
    void shouldNotNotifyOrResurrectSubscriptionDeletedDuringLookup() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).initialEvent(true).build());
        positionProvider.place(DEVICE_ID, INSIDE);
        positionProvider.onLookup = () -> lifecycleService.delete(sub.getId());

        monitor.runPass();

        verify(notificationDispatcher, never()).notify(any(), eq(AREA_ENTERED), any());
        verify(notificationDispatcher).notify(any(), eq(SUBSCRIPTION_ENDS), eq(SUBSCRIPTION_DELETED));
        assertThat(subscriptionStore.findById(sub.getId())).isEmpty();
        assertThat(subscriptionStore.findState(sub.getId())).isEmpty();
    }

    @Test
    void shouldKeepTransitionPendingWhenHandOffFails() {
        Subscription sub = subscriptionStore.save(subscription(AREA_ENTERED).initialEvent(true).build());
        positionProvider.place(DEVICE_ID, INSIDE);
        when(notificationDispatcher.notify(eq(sub), eq(AREA_ENTERED), isNull()))
                .thenThrow(new IllegalStateException("executor shut down"))
                .thenReturn(CompletableFuture.completedFuture(DeliveryResult.delivered(200)));

        MonitorPassSummary failedPass = monitor.runPass();

        assertThat(failedPass.failed()).isEqualTo(1);
        assertThat(state(sub).getClassification()).isEqualTo(Classification.UNKNOWN);
        assertThat(state(sub).getEventsSent()).isZero();

        MonitorPassSummary retried = monitor.runPass();

        assertThat(retried.notified()).isEqualTo(1);
        assertThat(state(sub).getClassification()).isEqualTo(Classification.INSIDE);
        assertThat(state(sub).getEventsSent()).isEqualTo(1);
        verify(notificationDispatcher, times(2)).notify(eq(sub), eq(AREA_ENTERED), isNull());
    }

    @Test
    void shouldIsolateFailingSubscription() {
        subscriptionStore.save(subscription(AREA_ENTERED)
                .device(DeviceRecord.ofNetworkAccessIdentifier("broken"))
                .initialEvent(true)
                .build());
        Subscription healthy = subscriptionStore.save(subscription(AREA_ENTERED).initialEvent(true).build());
        positionProvider.place(DEVICE_ID, INSIDE);
        positionProvider.broken.add("broken");

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.scanned()).isEqualTo(2);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.notified()).isEqualTo(1);
        verify(notificationDispatcher).notify(eq(healthy), eq(AREA_ENTERED), isNull());
    }

    @Test
    void shouldNotifyAreaLeftWhenDeviceMovesFarAway() {
        Subscription sub = subscriptionStore.save(subscription(AREA_LEFT).build());
        positionProvider.place(DEVICE_ID, new DevicePositionRecord(0, 0, Instant.now()));
        monitor.runPass();

        assertThat(state(sub).getClassification()).isEqualTo(Classification.INSIDE);
        verifyNoInteractions(notificationDispatcher);

        positionProvider.place(DEVICE_ID, new DevicePositionRecord(10, 10, Instant.now()));
        monitor.runPass();

        SubscriptionRuntimeState state = state(sub);
        assertThat(state.getClassification()).isEqualTo(Classification.OUTSIDE);
        assertThat(state.getLastDistanceMeters()).isEqualTo(AreaMath.distanceMeters(10, 10, 0, 0));
        assertThat(state.getLastDistanceMeters()).isCloseTo(1_568_520.56, within(0.01));
        assertThat(state.getEventsSent()).isEqualTo(1);
        verify(notificationDispatcher, times(1)).notify(eq(sub), eq(AREA_LEFT), isNull());
    }

    @Test
    void shouldNotEvaluateAfterStop() {
        subscriptionStore.save(subscription(AREA_ENTERED).initialEvent(true).build());
        positionProvider.place(DEVICE_ID, INSIDE);

        monitor.stop();
        monitor.scheduledPass();
        monitor.runPass();

        assertThat(monitor.isStopping()).isTrue();
        assertThat(positionProvider.lookups.get()).isZero();
        verifyNoInteractions(notificationDispatcher);
    }

    private SubscriptionRuntimeState state(Subscription subscription) {
        return subscriptionStore.findState(subscription.getId()).orElseThrow();
    }

    private static final class FakePositionProvider implements PositionProvider {

        private final Map<String, DevicePositionRecord> positions = new HashMap<>();
        private final Set<String> unavailable = new HashSet<>();
        private final Set<String> broken = new HashSet<>();
        private final AtomicInteger lookups = new AtomicInteger();
        private Runnable onLookup;

        void place(String deviceId, DevicePositionRecord position) {
            positions.put(deviceId, position);
        }

        @Override
        public Optional<DevicePositionRecord> getPosition(String deviceId) {
            lookups.incrementAndGet();
            if (onLookup != null) {
                onLookup.run();
            }
            if (broken.contains(deviceId)) {
                throw new IllegalStateException("Unexpected payload for " + deviceId);
            }
            if (unavailable.contains(deviceId)) {
                throw new PositionUnavailableException("NEF unreachable");
            }
            return Optional.ofNullable(positions.get(deviceId));
        }
    }
}

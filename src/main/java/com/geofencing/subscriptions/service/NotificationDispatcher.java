package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.config.GeofencingProperties;
import com.geofencing.subscriptions.dto.CloudEventRecord;
import com.geofencing.subscriptions.dto.DeliveryResult;
import com.geofencing.subscriptions.dto.NotificationDataRecord;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.enums.GeofencingEventType;
import com.geofencing.subscriptions.enums.TerminationReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.net.URI;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Delivers geofencing CloudEvents to subscriber sinks.
 *
 * Delivery Semantics:
 * - One HTTP POST per event, bounded by the configured timeout
 * - Runs on the notification executor; callers get a future and never block on the sink
 * - Best effort: failures are logged and reported in the {@link DeliveryResult},
 *   never thrown and never retried
 */
@Service
@Slf4j
public class NotificationDispatcher {

    private final RestClient notificationRestClient;
    private final Executor notificationExecutor;
    private final String source;

    public NotificationDispatcher(
        @Qualifier("notificationRestClient") RestClient notificationRestClient,
        @Qualifier("notificationExecutor") Executor notificationExecutor,
        GeofencingProperties properties
    ) {
        this.notificationRestClient = notificationRestClient;
        this.notificationExecutor = notificationExecutor;
        this.source = properties.getNotifications().getSource();
    }

    /**
     * Builds the envelope for {@code eventType} and schedules its delivery to the subscription sink.
     *
     * @param subscription      Subscription the event belongs to
     * @param eventType         Event to emit
     * @param terminationReason Reason for "subscription-ends" events, ignored otherwise
     * @return future completed with the delivery outcome
     */
    public CompletableFuture<DeliveryResult> notify(
        Subscription subscription,
        GeofencingEventType eventType,
        TerminationReason terminationReason
    ) {
        CloudEventRecord event = buildEvent(subscription, eventType, terminationReason);
        String sink = subscription.getSink();

        try {
            return CompletableFuture.supplyAsync(() -> deliver(sink, event), notificationExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Notification executor rejected {} for {}", event.toLogString(), sink);
            return CompletableFuture.completedFuture(DeliveryResult.failed("Delivery rejected: " + e.getMessage()));
        }
    }

    /**
     * Builds a CloudEvents 1.0 envelope. The time attribute is always in UTC "Z" form.
     */
    public CloudEventRecord buildEvent(
        Subscription subscription,
        GeofencingEventType eventType,
        TerminationReason terminationReason
    ) {
        TerminationReason reason = null;
        if (eventType == GeofencingEventType.SUBSCRIPTION_ENDS) {
            reason = terminationReason != null ? terminationReason : TerminationReason.SUBSCRIPTION_EXPIRED;
        }

        NotificationDataRecord data = new NotificationDataRecord(
            subscription.getId(),
            subscription.getDevice(),
            subscription.getArea(),
            reason
        );

        return new CloudEventRecord(
            UUID.randomUUID().toString(),
            source,
            eventType.getType(),
            CloudEventRecord.SPEC_VERSION,
            CloudEventRecord.CONTENT_TYPE,
            Instant.now().toString(),
            data
        );
    }

    /**
     * POSTs one event synchronously.
     */
    DeliveryResult deliver(String sink, CloudEventRecord event) {
        log.debug("Sending {} to {}", event.toLogString(), sink);
        try {
            ResponseEntity<Void> response = notificationRestClient.post()
                .uri(URI.create(sink))
                .contentType(MediaType.APPLICATION_JSON)
                .body(event)
                .retrieve()
                .toBodilessEntity();

            int status = response.getStatusCode().value();
            log.info("Delivered {} to {} (HTTP {})", event.toLogString(), sink, status);
            return DeliveryResult.delivered(status);
        } catch (RestClientResponseException e) {
            log.warn("Sink {} rejected {} with HTTP {}", sink, event.toLogString(), e.getStatusCode().value());
            return DeliveryResult.rejected(e.getStatusCode().value(), e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Failed to deliver {} to {}: {}", event.toLogString(), sink, e.getMessage());
            return DeliveryResult.failed(e.getMessage());
        }
    }
}

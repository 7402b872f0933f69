package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.config.GeofencingProperties;
import com.geofencing.subscriptions.dto.AreaRecord;
import com.geofencing.subscriptions.dto.DeviceRecord;
import com.geofencing.subscriptions.dto.SubscriptionConfigRecord;
import com.geofencing.subscriptions.dto.SubscriptionDetailRecord;
import com.geofencing.subscriptions.dto.SubscriptionRequest;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.enums.GeofencingEventType;
import com.geofencing.subscriptions.enums.SubscriptionStatus;
import com.geofencing.subscriptions.enums.TerminationReason;
import com.geofencing.subscriptions.exception.ApiErrorCode;
import com.geofencing.subscriptions.exception.GeofencingApiException;
import com.geofencing.subscriptions.exception.SubscriptionNotFoundException;
import com.geofencing.subscriptions.repository.SubscriptionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, reads and ends geofencing subscriptions.
 *
 * Creation Flow:
 * 1. Validate the request (protocol, device, area type, event types, radius)
 * 2. Assign id, start time and ACTIVE status
 * 3. Store the subscription with a fresh runtime state
 *
 * Termination:
 * Explicit deletes and the monitor (expiry, quota) both go through {@link #terminate}.
 * Only the caller that actually removes the subscription emits "subscription-ends",
 * so a subscription ends exactly once even when a delete races with expiry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubscriptionLifecycleService {

    static final String SUPPORTED_PROTOCOL = "HTTP";

    private final SubscriptionStore subscriptionStore;
    private final NotificationDispatcher notificationDispatcher;
    private final GeofencingProperties properties;

    /**
     * Validates and stores a new subscription.
     *
     * @throws GeofencingApiException with the matching error code if the request is rejected;
     *                                nothing is stored in that case
     */
    public Subscription create(SubscriptionRequest request) {
        if (!SUPPORTED_PROTOCOL.equals(request.protocol())) {
            throw new GeofencingApiException(ApiErrorCode.INVALID_PROTOCOL, "Only HTTP is supported.");
        }

        SubscriptionConfigRecord config = request.config();
        SubscriptionDetailRecord detail = config.subscriptionDetail();

        DeviceRecord device = detail.device();
        if (device == null || !device.hasIdentifier()) {
            throw new GeofencingApiException(ApiErrorCode.MISSING_IDENTIFIER,
                "The device cannot be identified.");
        }

        AreaRecord area = detail.area();
        if (!area.isCircle()) {
            throw new GeofencingApiException(ApiErrorCode.SUBSCRIPTION_AREA_NOT_COVERED,
                "Only areaType=CIRCLE is supported.");
        }

        if (request.types().size() != 1) {
            throw new GeofencingApiException(ApiErrorCode.MULTIEVENT_SUBSCRIPTION_NOT_SUPPORTED,
                "Multi event types subscription not managed.");
        }

        double minRadius = properties.getArea().getMinRadiusMeters();
        if (!area.hasCenter() || area.radius() == null || area.radius() < minRadius) {
            throw new GeofencingApiException(ApiErrorCode.SUBSCRIPTION_INVALID_AREA,
                "The requested area is too small or incomplete");
        }

        GeofencingEventType eventType = GeofencingEventType.fromType(request.types().get(0))
            .filter(GeofencingEventType::isAreaEvent)
            .orElseThrow(() -> new GeofencingApiException(ApiErrorCode.INVALID_ARGUMENT,
                "Unsupported event type: " + request.types().get(0)));

        Instant expiresAt = parseExpireTime(config.subscriptionExpireTime());

        Subscription subscription = Subscription.builder()
            .id(UUID.randomUUID().toString())
            .protocol(request.protocol())
            .sink(request.sink())
            .eventType(eventType)
            .device(device)
            .area(AreaRecord.circle(area.center(), area.radius()))
            .initialEvent(Boolean.TRUE.equals(config.initialEvent()))
            .maxEvents(config.subscriptionMaxEvents())
            .expiresAt(expiresAt)
            .status(SubscriptionStatus.ACTIVE)
            .startsAt(Instant.now())
            .build();

        subscriptionStore.save(subscription);
        log.info("Created {}", subscription.toLogString());
        return subscription;
    }

    /**
     * @throws SubscriptionNotFoundException if the id is unknown
     */
    public Subscription get(String id) {
        return subscriptionStore.findById(id)
            .orElseThrow(() -> new SubscriptionNotFoundException(id));
    }

    public List<Subscription> list() {
        return subscriptionStore.findAll();
    }

    /**
     * Deletes a subscription and emits "subscription-ends" with reason SUBSCRIPTION_DELETED.
     *
     * @throws SubscriptionNotFoundException if the id is unknown or already removed
     */
    public void delete(String id) {
        if (!terminate(id, TerminationReason.SUBSCRIPTION_DELETED)) {
            throw new SubscriptionNotFoundException(id);
        }
    }

    /**
     * Removes a subscription with its runtime state and notifies the sink.
     *
     * @return true if this call removed the subscription, false if it was already gone
     */
    public boolean terminate(String id, TerminationReason reason) {
        Optional<Subscription> removed = subscriptionStore.remove(id);
        if (removed.isEmpty()) {
            return false;
        }

        notificationDispatcher.notify(removed.get(), GeofencingEventType.SUBSCRIPTION_ENDS, reason);
        log.info("Subscription {} ended: {}", id, reason);
        return true;
    }

    private static Instant parseExpireTime(String expireTime) {
        if (expireTime == null || expireTime.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(expireTime).toInstant();
        } catch (DateTimeParseException e) {
            throw new GeofencingApiException(ApiErrorCode.INVALID_ARGUMENT,
                "subscriptionExpireTime must be an ISO-8601 date-time: " + expireTime);
        }
    }
}

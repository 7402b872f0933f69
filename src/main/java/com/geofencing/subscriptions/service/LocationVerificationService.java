package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.dto.AreaRecord;
import com.geofencing.subscriptions.dto.DevicePositionRecord;
import com.geofencing.subscriptions.dto.PointRecord;
import com.geofencing.subscriptions.dto.RetrievalRequest;
import com.geofencing.subscriptions.dto.RetrievalResponse;
import com.geofencing.subscriptions.dto.VerificationRequest;
import com.geofencing.subscriptions.dto.VerificationResponse;
import com.geofencing.subscriptions.enums.VerificationResult;
import com.geofencing.subscriptions.exception.ApiErrorCode;
import com.geofencing.subscriptions.exception.GeofencingApiException;
import com.geofencing.subscriptions.exception.PositionUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Synchronous location queries: "is the device in this area" and "where is the device".
 *
 * Verification uses the same {@link AreaMath} containment rule as the subscription monitor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LocationVerificationService {

    /**
     * Radius used when a verification request omits it, and the accuracy reported by retrieval.
     */
    static final double DEFAULT_RADIUS_METERS = 100.0;

    private final PositionProvider positionProvider;

    /**
     * Verifies whether a device is inside a circle.
     *
     * @return TRUE/FALSE with the distance to the center, or UNKNOWN when no position is available
     */
    public VerificationResponse verify(VerificationRequest request) {
        String deviceId = request.device().positionIdentifier();
        if (deviceId == null) {
            throw new GeofencingApiException(ApiErrorCode.MISSING_IDENTIFIER,
                "Only networkAccessIdentifier (IMSI/SUPI) is supported in this implementation.");
        }

        AreaRecord area = request.area();
        if (!area.isCircle()) {
            throw new GeofencingApiException(ApiErrorCode.VERIFICATION_AREA_NOT_COVERED,
                "Only areaType=CIRCLE is supported.");
        }
        if (!area.hasCenter()) {
            throw new GeofencingApiException(ApiErrorCode.VERIFICATION_INVALID_AREA,
                "Center latitude and longitude are required.");
        }

        double radius = area.radius() == null || area.radius() == 0 ? DEFAULT_RADIUS_METERS : area.radius();

        Optional<DevicePositionRecord> position = lookup(deviceId);
        if (position.isEmpty()) {
            return VerificationResponse.unknown();
        }

        double distance = AreaMath.distanceMeters(position.get().toPoint(), area.center());
        boolean inside = AreaMath.isInside(position.get().toPoint(), AreaRecord.circle(area.center(), radius));

        log.debug("Verified device {}: distance={}m, radius={}m, inside={}", deviceId, distance, radius, inside);

        return new VerificationResponse(
            inside ? VerificationResult.TRUE : VerificationResult.FALSE,
            position.get().observedAt().toString(),
            Math.round(distance * 100.0) / 100.0
        );
    }

    /**
     * Returns the device location as a circle around its last known position.
     */
    public RetrievalResponse retrieve(RetrievalRequest request) {
        String deviceId = request.device() != null ? request.device().networkAccessIdentifier() : null;
        if (deviceId == null || deviceId.isBlank()) {
            throw new GeofencingApiException(ApiErrorCode.MISSING_IDENTIFIER,
                "Only networkAccessIdentifier (IMSI/SUPI) is supported in this implementation.");
        }
        if (request.maxAge() != null && request.maxAge() == 0) {
            throw new GeofencingApiException(ApiErrorCode.RETRIEVAL_UNABLE_TO_FULFILL_MAX_AGE,
                "Unable to provide expected freshness for location");
        }
        if (request.maxSurface() != null) {
            throw new GeofencingApiException(ApiErrorCode.RETRIEVAL_UNABLE_TO_FULFILL_MAX_SURFACE,
                "Unable to provide accurate acceptable surface for location");
        }

        DevicePositionRecord position = lookup(deviceId)
            .orElseThrow(() -> new GeofencingApiException(ApiErrorCode.RETRIEVAL_DEVICE_NOT_FOUND,
                "The location server is not able to locate the mobile"));

        PointRecord center = position.toPoint();
        return new RetrievalResponse(
            position.observedAt().toString(),
            AreaRecord.circle(center, DEFAULT_RADIUS_METERS)
        );
    }

    private Optional<DevicePositionRecord> lookup(String deviceId) {
        try {
            return positionProvider.getPosition(deviceId);
        } catch (PositionUnavailableException e) {
            log.warn("Position lookup for {} failed: {}", deviceId, e.getMessage());
            return Optional.empty();
        }
    }
}

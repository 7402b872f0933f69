package com.geofencing.subscriptions.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.geofencing.subscriptions.dto.DevicePositionRecord;
import com.geofencing.subscriptions.exception.PositionUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Instant;
import java.util.Optional;

/**
 * Position provider backed by the NEF emulator UE registry.
 *
 * Flow:
 * 1. GET /api/v1/UEs/{supi} with the current bearer token
 * 2. 404 or missing coordinates: device not found (empty)
 * 3. 401: token is refreshed and the lookup retried once
 * 4. Any other failure: {@link PositionUnavailableException}
 *
 * The NEF emulator does not report when a UE last moved, so the lookup time is
 * used as the observation time.
 */
@Service
@Slf4j
public class NefPositionProvider implements PositionProvider {

    static final String UE_PATH = "/api/v1/UEs/{supi}";

    private final RestClient nefRestClient;
    private final NefAccessToken accessToken;

    public NefPositionProvider(@Qualifier("nefRestClient") RestClient nefRestClient, NefAccessToken accessToken) {
        this.nefRestClient = nefRestClient;
        this.accessToken = accessToken;
    }

    @Override
    public Optional<DevicePositionRecord> getPosition(String deviceId) {
        String token = accessToken.get();
        try {
            return fetch(deviceId, token);
        } catch (HttpClientErrorException.Unauthorized e) {
            log.info("NEF rejected the access token, re-authenticating");
            accessToken.invalidate(token);
            try {
                return fetch(deviceId, accessToken.get());
            } catch (RestClientException retryFailure) {
                throw unavailable(deviceId, retryFailure);
            }
        } catch (RestClientException e) {
            throw unavailable(deviceId, e);
        }
    }

    private Optional<DevicePositionRecord> fetch(String deviceId, String token) {
        UeResponse ue;
        try {
            ue = nefRestClient.get()
                .uri(UE_PATH, deviceId)
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .retrieve()
                .body(UeResponse.class);
        } catch (HttpClientErrorException.NotFound e) {
            log.debug("Device {} not known to NEF", deviceId);
            return Optional.empty();
        }

        if (ue == null || ue.latitude() == null || ue.longitude() == null) {
            log.debug("Device {} has no position", deviceId);
            return Optional.empty();
        }

        return Optional.of(new DevicePositionRecord(ue.latitude(), ue.longitude(), Instant.now()));
    }

    private static PositionUnavailableException unavailable(String deviceId, RestClientException cause) {
        return new PositionUnavailableException(
            "Position of " + deviceId + " unavailable: " + cause.getMessage(), cause);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record UeResponse(
        String supi,
        Double latitude,
        Double longitude
    ) {
    }
}

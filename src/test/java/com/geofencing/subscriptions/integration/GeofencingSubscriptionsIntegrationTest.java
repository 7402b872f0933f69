package com.geofencing.subscriptions.integration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geofencing.subscriptions.dto.DevicePositionRecord;
import com.geofencing.subscriptions.dto.MonitorPassSummary;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.service.NotificationDispatcher;
import com.geofencing.subscriptions.service.PositionProvider;
import com.geofencing.subscriptions.service.SubscriptionMonitor;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static com.geofencing.subscriptions.enums.GeofencingEventType.AREA_ENTERED;
import static com.geofencing.subscriptions.enums.GeofencingEventType.SUBSCRIPTION_ENDS;
import static com.geofencing.subscriptions.enums.TerminationReason.SUBSCRIPTION_DELETED;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class GeofencingSubscriptionsIntegrationTest {

    private static final String BASE = "/geofencing-subscriptions/v0.4/subscriptions";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SubscriptionMonitor monitor;

    @MockBean
    private PositionProvider positionProvider;

    @MockBean
    private NotificationDispatcher notificationDispatcher;

    @Test
    void shouldReturnHealthy() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"));
    }

    @Test
    void shouldNotifyAndDeleteSubscription() throws Exception {
        String deviceId = "202010000000042";
        String created = mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(subscriptionBody(deviceId, "CIRCLE", 500, true)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andReturn().getResponse().getContentAsString();
        JsonNode body = objectMapper.readTree(created);
        String id = body.get("id").asText();

        mockMvc.perform(get(BASE + "/" + id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.config.subscriptionDetail.device.networkAccessIdentifier").value(deviceId));

        when(positionProvider.getPosition(deviceId))
                .thenReturn(Optional.of(new DevicePositionRecord(37.9901, 23.8101, Instant.now())));

        MonitorPassSummary summary = monitor.runPass();

        assertThat(summary.notified()).isGreaterThanOrEqualTo(1);
        verify(notificationDispatcher).notify(argThat((Subscription s) -> s.getId().equals(id)), eq(AREA_ENTERED), isNull());

        mockMvc.perform(delete(BASE + "/" + id))
                .andExpect(status().isNoContent());
        verify(notificationDispatcher).notify(argThat((Subscription s) -> s.getId().equals(id)),
                eq(SUBSCRIPTION_ENDS), eq(SUBSCRIPTION_DELETED));

        mockMvc.perform(get(BASE + "/" + id))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
        mockMvc.perform(delete(BASE + "/" + id))
                .andExpect(status().isNotFound());
    }

    @Test
    void shouldRejectSmallArea() throws Exception {
        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(subscriptionBody("202010000000043", "CIRCLE", 50, false)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("GEOFENCING_SUBSCRIPTIONS.INVALID_AREA"));
    }

    @Test
    void shouldRejectPolygonArea() throws Exception {
        mockMvc.perform(post(BASE)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(subscriptionBody("202010000000044", "POLYGON", 500, false)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("GEOFENCING_SUBSCRIPTIONS.AREA_NOT_COVERED"));
    }

    @Test
    void shouldVerifyLocation() throws Exception {
        when(positionProvider.getPosition("202010000000045"))
                .thenReturn(Optional.of(new DevicePositionRecord(37.99, 23.81, Instant.now())));

        mockMvc.perform(post("/location-verification/v1/location/verify")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"device": {"networkAccessIdentifier": "202010000000045"},
                                 "area": {"areaType": "CIRCLE", "center": {"latitude": 37.99, "longitude": 23.81}}}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verificationResult").value("TRUE"))
                .andExpect(jsonPath("$.distance").value(0.0));
    }

    @Test
    void shouldReturnNotFoundForUnknownPath() throws Exception {
        mockMvc.perform(get("/does-not-exist"))
                .andExpect(status().isNotFound());
    }

    private static String subscriptionBody(String deviceId, String areaType, int radius, boolean initialEvent) {
        return """
                {
                  "protocol": "HTTP",
                  "sink": "http://localhost:9000/callback",
                  "types": ["org.camaraproject.geofencing-subscriptions.v0.area-entered"],
                  "config": {
                    "subscriptionDetail": {
                      "device": {"networkAccessIdentifier": "%s"},
                      "area": {"areaType": "%s", "center": {"latitude": 37.99, "longitude": 23.81}, "radius": %d}
                    },
                    "initialEvent": %s
                  }
                }
                """.formatted(deviceId, areaType, radius, initialEvent);
    }
}

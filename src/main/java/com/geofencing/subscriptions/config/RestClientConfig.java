package com.geofencing.subscriptions.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Duration;

/**
 * RestClient configuration for outbound HTTP calls.
 *
 * Two clients are built from the auto-configured RestClient.Builder:
 * - notificationRestClient: POSTs CloudEvents to subscriber sinks (absolute URLs)
 * - nefRestClient: reads device positions from the NEF emulator (base URL preset)
 *
 * Both carry their own connect/read timeout so a single slow peer is bounded.
 */
@Configuration
public class RestClientConfig {

    @Bean
    public RestClient notificationRestClient(RestClient.Builder builder, GeofencingProperties properties) {
        return builder.clone()
                .requestFactory(requestFactory(properties.getNotifications().getTimeout()))
                .build();
    }

    @Bean
    public RestClient nefRestClient(RestClient.Builder builder, GeofencingProperties properties) {
        GeofencingProperties.Nef nef = properties.getNef();
        return builder.clone()
                .baseUrl(nef.getBaseUrl())
                .requestFactory(requestFactory(nef.getTimeout()))
                .build();
    }

    private static SimpleClientHttpRequestFactory requestFactory(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }
}

package com.geofencing.subscriptions;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main entry point for the Geofencing Subscriptions service.
 *
 * Annotations Explained:
 * - @SpringBootApplication: Combines @Configuration, @EnableAutoConfiguration, @ComponentScan
 * - @ConfigurationPropertiesScan: Binds the "geofencing.*" properties
 * - @EnableScheduling: Enables @Scheduled annotation for the subscription monitor
 *
 * Flow:
 * 1. A client creates a subscription (device + circular area + one event type)
 * 2. The subscription is validated and kept in the in-memory store
 * 3. The monitor polls the device position every few seconds
 * 4. Area transitions are detected with a haversine distance check
 * 5. CloudEvent notifications are POSTed to the subscriber's sink
 * 6. Expired, exhausted or deleted subscriptions end with a "subscription-ends" event
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class GeofencingSubscriptionsApplication {

    public static void main(String[] args) {
        SpringApplication.run(GeofencingSubscriptionsApplication.class, args);
    }
}

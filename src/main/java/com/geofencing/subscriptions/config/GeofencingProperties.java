package com.geofencing.subscriptions.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Configuration properties for the geofencing engine.
 *
 * Maps to:
 * geofencing:
 *   monitor:
 *     enabled: true
 *     interval: PT3S
 *   area:
 *     min-radius-meters: 100
 *   notifications:
 *     source: urn:nef-emulator
 *     timeout: PT5S
 *   nef:
 *     base-url: http://localhost:8888
 */
@ConfigurationProperties(prefix = "geofencing")
@Data
public class GeofencingProperties {

    private Monitor monitor = new Monitor();

    private Area area = new Area();

    private Notifications notifications = new Notifications();

    private Nef nef = new Nef();

    @Data
    public static class Monitor {

        /**
         * Whether the scheduled monitor pass runs. Tests drive passes manually.
         */
        private boolean enabled = true;

        /**
         * Delay between the end of one pass and the start of the next.
         */
        private Duration interval = Duration.ofSeconds(3);

        private Duration initialDelay = Duration.ofSeconds(3);
    }

    @Data
    public static class Area {

        /**
         * Smallest radius accepted for a subscription area.
         */
        private double minRadiusMeters = 100.0;
    }

    @Data
    public static class Notifications {

        /**
         * Value of the CloudEvent "source" attribute.
         */
        private String source = "urn:nef-emulator";

        /**
         * Connect and read timeout for a single webhook POST.
         */
        private Duration timeout = Duration.ofSeconds(5);

        private int executorPoolSize = 4;

        private int executorQueueCapacity = 500;
    }

    @Data
    public static class Nef {

        private String baseUrl = "http://localhost:8888";

        private String username = "admin@my-email.com";

        private String password = "pass";

        private Duration timeout = Duration.ofSeconds(5);
    }
}

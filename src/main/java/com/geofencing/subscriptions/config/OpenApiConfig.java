package com.geofencing.subscriptions.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI (Swagger) configuration for API documentation.
 *
 * Interactive documentation is served at:
 * - Swagger UI: http://localhost:8080/swagger-ui.html
 * - OpenAPI JSON: http://localhost:8080/v3/api-docs
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI geofencingOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Geofencing Subscriptions API")
                        .description("Device geofencing subscriptions backed by the NEF emulator.\n\n" +
                                "## Features\n\n" +
                                "- **Subscriptions** - area-entered / area-left notifications for circular areas\n" +
                                "- **CloudEvents webhooks** - events POSTed to the subscription sink\n" +
                                "- **Location verification** - one-off inside/outside check\n" +
                                "- **Location retrieval** - last known device position\n\n" +
                                "## Monitoring\n\n" +
                                "1. Every few seconds all subscriptions are scanned\n" +
                                "2. Expired or exhausted subscriptions end with a subscription-ends event\n" +
                                "3. Device positions are fetched from the NEF emulator\n" +
                                "4. A matching inside/outside transition notifies the sink\n\n" +
                                "## Getting Started\n\n" +
                                "1. Start the NEF emulator\n" +
                                "2. Run: `mvn spring-boot:run`\n" +
                                "3. Use `http://localhost:" + serverPort + "/callback` as sink to see events in the log")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}

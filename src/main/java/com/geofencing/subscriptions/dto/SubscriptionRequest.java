package com.geofencing.subscriptions.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.URL;

import java.util.List;

/**
 * Body of a subscription creation request.
 *
 * The protocol is checked by the lifecycle service (INVALID_PROTOCOL), not here.
 *
 * @param protocol Delivery protocol, only "HTTP" is supported
 * @param sink     http(s) callback URL receiving the CloudEvents
 * @param types    Exactly one fully qualified area event type
 * @param config   Subscription configuration
 */
public record SubscriptionRequest(
    String protocol,

    @NotBlank(message = "Sink is required")
    @URL(regexp = "^(http|https)://.*", message = "Sink must be a valid http or https URL")
    String sink,

    @NotNull(message = "Types are required")
    List<String> types,

    @NotNull(message = "Config is required")
    @Valid
    SubscriptionConfigRecord config
) {
}

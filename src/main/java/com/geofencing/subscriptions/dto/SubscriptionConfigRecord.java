package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

/**
 * Subscription configuration.
 *
 * @param subscriptionDetail     Device and area to watch
 * @param initialEvent           Whether the first evaluation may itself notify
 * @param subscriptionMaxEvents  Optional cap on notifications before the subscription ends
 * @param subscriptionExpireTime Optional ISO-8601 instant after which the subscription ends
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SubscriptionConfigRecord(
    @NotNull(message = "Subscription detail is required")
    @Valid
    SubscriptionDetailRecord subscriptionDetail,

    Boolean initialEvent,

    @Positive(message = "Max events must be > 0")
    Integer subscriptionMaxEvents,

    String subscriptionExpireTime
) {
}

package com.geofencing.subscriptions.controller;

import com.geofencing.subscriptions.dto.ErrorResponse;
import com.geofencing.subscriptions.dto.SubscriptionRequest;
import com.geofencing.subscriptions.dto.SubscriptionResponse;
import com.geofencing.subscriptions.entity.Subscription;
import com.geofencing.subscriptions.service.SubscriptionLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST Controller for managing geofencing subscriptions.
 *
 * Endpoints:
 * 1. Create a subscription for area-entered or area-left
 * 2. List all active subscriptions
 * 3. Read a single subscription
 * 4. Delete a subscription (emits subscription-ends)
 *
 * Notifications are pushed to the subscription sink as CloudEvents by the background monitor.
 */
@RestController
@RequestMapping("/geofencing-subscriptions/v0.4/subscriptions")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Geofencing Subscriptions", description = "Subscribe to devices entering or leaving a circular area")
public class GeofencingSubscriptionController {

    private final SubscriptionLifecycleService lifecycleService;

    /**
     * Example request:
     * POST /geofencing-subscriptions/v0.4/subscriptions
     * {
     *   "protocol": "HTTP",
     *   "sink": "http://localhost:9000/callback",
     *   "types": ["org.camaraproject.geofencing-subscriptions.v0.area-entered"],
     *   "config": {
     *     "subscriptionDetail": {
     *       "device": {"networkAccessIdentifier": "202010000000001"},
     *       "area": {"areaType": "CIRCLE", "center": {"latitude": 37.99, "longitude": 23.81}, "radius": 500}
     *     },
     *     "initialEvent": true,
     *     "subscriptionMaxEvents": 5
     *   }
     * }
     */
    @Operation(
            summary = "Create a geofencing subscription",
            description = "Validates the request and starts monitoring the device against the circle. " +
                    "Exactly one event type per subscription is supported."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Subscription created"),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid protocol or argument",
                    content = @Content(
                            mediaType = "application/json",
                            schema = @Schema(implementation = ErrorResponse.class),
                            examples = @ExampleObject(
                                    name = "Invalid protocol",
                                    value = "{\"status\":400,\"code\":\"INVALID_PROTOCOL\",\"message\":\"Only HTTP is supported.\"}"
                            )
                    )
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "Request not processable (device, area or event types)",
                    content = @Content(
                            mediaType = "application/json",
                            schema = @Schema(implementation = ErrorResponse.class),
                            examples = @ExampleObject(
                                    name = "Area too small",
                                    value = "{\"status\":422,\"code\":\"GEOFENCING_SUBSCRIPTIONS.INVALID_AREA\",\"message\":\"The requested area is too small or incomplete\"}"
                            )
                    )
            )
    })
    @PostMapping
    public ResponseEntity<SubscriptionResponse> createSubscription(@Valid @RequestBody SubscriptionRequest request) {
        log.debug("Create subscription request for sink {}", request.sink());
        Subscription subscription = lifecycleService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(SubscriptionResponse.from(subscription));
    }

    @Operation(summary = "List subscriptions", description = "Returns all subscriptions that have not ended.")
    @GetMapping
    public ResponseEntity<List<SubscriptionResponse>> listSubscriptions() {
        List<SubscriptionResponse> subscriptions = lifecycleService.list().stream()
                .map(SubscriptionResponse::from)
                .toList();
        return ResponseEntity.ok(subscriptions);
    }

    @Operation(summary = "Get a subscription")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Subscription found"),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown subscription id",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    @GetMapping("/{subscriptionId}")
    public ResponseEntity<SubscriptionResponse> getSubscription(
            @Parameter(description = "Subscription id returned at creation")
            @PathVariable String subscriptionId
    ) {
        return ResponseEntity.ok(SubscriptionResponse.from(lifecycleService.get(subscriptionId)));
    }

    @Operation(
            summary = "Delete a subscription",
            description = "Stops monitoring and sends a subscription-ends event with reason SUBSCRIPTION_DELETED."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Subscription deleted"),
            @ApiResponse(
                    responseCode = "404",
                    description = "Unknown subscription id",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    @DeleteMapping("/{subscriptionId}")
    public ResponseEntity<Void> deleteSubscription(@PathVariable String subscriptionId) {
        lifecycleService.delete(subscriptionId);
        return ResponseEntity.noContent().build();
    }
}

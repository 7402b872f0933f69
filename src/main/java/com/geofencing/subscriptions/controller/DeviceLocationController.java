package com.geofencing.subscriptions.controller;

import com.geofencing.subscriptions.dto.ErrorResponse;
import com.geofencing.subscriptions.dto.RetrievalRequest;
import com.geofencing.subscriptions.dto.RetrievalResponse;
import com.geofencing.subscriptions.dto.VerificationRequest;
import com.geofencing.subscriptions.dto.VerificationResponse;
import com.geofencing.subscriptions.service.LocationVerificationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Synchronous device location APIs.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Device Location", description = "One-off location verification and retrieval")
public class DeviceLocationController {

    private final LocationVerificationService locationVerificationService;

    @Operation(
            summary = "Verify device location",
            description = "Checks whether the device is inside the given circle. " +
                    "The radius defaults to 100 m when omitted. Returns UNKNOWN if no position is available."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Verification result",
                    content = @Content(
                            mediaType = "application/json",
                            examples = {
                                    @ExampleObject(
                                            name = "Inside",
                                            value = "{\"verificationResult\":\"TRUE\",\"lastLocationTime\":\"2024-01-01T12:00:00Z\",\"distance\":42.17}"
                                    ),
                                    @ExampleObject(
                                            name = "No position",
                                            value = "{\"verificationResult\":\"UNKNOWN\"}"
                                    )
                            }
                    )
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "Missing identifier or unsupported area",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    @PostMapping("/location-verification/v1/location/verify")
    public ResponseEntity<VerificationResponse> verify(@Valid @RequestBody VerificationRequest request) {
        return ResponseEntity.ok(locationVerificationService.verify(request));
    }

    @Operation(
            summary = "Retrieve device location",
            description = "Returns a circle centered on the last known device position."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Device located"),
            @ApiResponse(
                    responseCode = "404",
                    description = "Device could not be located",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
            ),
            @ApiResponse(
                    responseCode = "422",
                    description = "Missing identifier, maxAge or maxSurface cannot be fulfilled",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
            )
    })
    @PostMapping("/location-retrieval/v0.4/retrieve")
    public ResponseEntity<RetrievalResponse> retrieve(@Valid @RequestBody RetrievalRequest request) {
        return ResponseEntity.ok(locationVerificationService.retrieve(request));
    }
}

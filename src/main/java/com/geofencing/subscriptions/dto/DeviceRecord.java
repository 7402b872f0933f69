package com.geofencing.subscriptions.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Device descriptor.
 *
 * At least one identifying field must be present. Positions can only be looked up
 * by network access identifier (IMSI/SUPI); "supi" is accepted as an alias of it by
 * the verification API.
 *
 * @param networkAccessIdentifier IMSI/SUPI, e.g. "IMSI123456789012345"
 * @param phoneNumber             MSISDN in E.164 format
 * @param ipv4Address             Device IPv4 address
 * @param ipv6Address             Device IPv6 address
 * @param supi                    Alias of networkAccessIdentifier
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceRecord(
    String networkAccessIdentifier,
    String phoneNumber,
    String ipv4Address,
    String ipv6Address,
    String supi
) {

    public static DeviceRecord ofNetworkAccessIdentifier(String networkAccessIdentifier) {
        return new DeviceRecord(networkAccessIdentifier, null, null, null, null);
    }

    @JsonIgnore
    public boolean hasIdentifier() {
        return isPresent(networkAccessIdentifier)
            || isPresent(phoneNumber)
            || isPresent(ipv4Address)
            || isPresent(ipv6Address)
            || isPresent(supi);
    }

    /**
     * Identifier usable for a position lookup, or null when the device cannot be located.
     */
    @JsonIgnore
    public String positionIdentifier() {
        if (isPresent(networkAccessIdentifier)) {
            return networkAccessIdentifier;
        }
        return isPresent(supi) ? supi : null;
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}

package com.geofencing.subscriptions.service;

import com.geofencing.subscriptions.dto.DevicePositionRecord;
import com.geofencing.subscriptions.exception.PositionUnavailableException;

import java.util.Optional;

/**
 * Source of device positions.
 */
public interface PositionProvider {

    /**
     * Returns the last known position of a device.
     *
     * @param deviceId Network access identifier (IMSI/SUPI) of the device
     * @return the position, or empty if the device is unknown or has no position
     * @throws PositionUnavailableException on transient failures of the source
     */
    Optional<DevicePositionRecord> getPosition(String deviceId);
}

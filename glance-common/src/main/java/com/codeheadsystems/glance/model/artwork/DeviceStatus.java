package com.codeheadsystems.glance.model.artwork;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Last status report of the e-ink device, from {@code GET /api/esp32-status}.
 *
 * @param batteryVoltage  battery voltage in volts; absent when the device never reported
 * @param batteryPercent  estimated charge percentage
 * @param isCharging      whether the device is on external power
 * @param signalStrength  WiFi RSSI in dBm
 * @param firmwareVersion firmware version string
 * @param lastSeen        epoch millis of the last report
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeviceStatus(
    Double batteryVoltage,
    Integer batteryPercent,
    Boolean isCharging,
    Integer signalStrength,
    String firmwareVersion,
    Long lastSeen) {
}

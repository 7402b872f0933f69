package com.geofencing.subscriptions.dto;

/**
 * Counters collected during one monitor pass.
 *
 * @param scanned    Subscriptions in the pass snapshot
 * @param notified   Area notifications dispatched
 * @param terminated Subscriptions ended by expiry or quota
 * @param skipped    Subscriptions left untouched this pass (no identifier, no position, gone)
 * @param failed     Subscriptions whose evaluation threw
 */
public record MonitorPassSummary(
    int scanned,
    int notified,
    int terminated,
    int skipped,
    int failed
) {

    public String toLogString() {
        return String.format("MonitorPass[scanned=%d, notified=%d, terminated=%d, skipped=%d, failed=%d]",
            scanned, notified, terminated, skipped, failed);
    }
}

package com.geofencing.subscriptions.dto;

/**
 * CloudEvents 1.0 envelope POSTed to a subscription sink.
 *
 * @param id              Unique event id
 * @param source          Fixed source tag of this service
 * @param type            Fully qualified event type
 * @param specversion     Always "1.0"
 * @param datacontenttype Always "application/json"
 * @param time            UTC timestamp, always ending in "Z"
 * @param data            Domain payload
 */
public record CloudEventRecord(
    String id,
    String source,
    String type,
    String specversion,
    String datacontenttype,
    String time,
    NotificationDataRecord data
) {

    public static final String SPEC_VERSION = "1.0";
    public static final String CONTENT_TYPE = "application/json";

    public String toLogString() {
        return String.format("CloudEvent[id=%s, type=%s, subscription=%s]",
            id, type, data != null ? data.subscriptionId() : null);
    }
}

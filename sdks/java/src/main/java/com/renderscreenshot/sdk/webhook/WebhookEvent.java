package com.renderscreenshot.sdk.webhook;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Represents a webhook notification sent by RenderScreenshot.
 *
 * <p>Only trust {@link #getData()} after the payload signature has been verified.</p>
 */
public class WebhookEvent {

    @JsonProperty("event")
    private String event;

    @JsonProperty("id")
    private String id;

    @JsonProperty("timestamp")
    private long timestamp;

    @JsonProperty("data")
    private Map<String, Object> data = new LinkedHashMap<>();

    // Default constructor for Jackson
    public WebhookEvent() {}

    public WebhookEvent(String event, String id, long timestamp, Map<String, Object> data) {
        this.event = event;
        this.id = id;
        this.timestamp = timestamp;
        this.data = data != null ? data : new LinkedHashMap<>();
    }

    /**
     * Returns the event type, e.g. {@code screenshot.completed}.
     */
    public String getEvent() {
        return event;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns the event time in unix seconds.
     */
    public long getTimestamp() {
        return timestamp;
    }

    public Instant getTime() {
        return Instant.ofEpochSecond(timestamp);
    }

    public Map<String, Object> getData() {
        return data;
    }

    @Override
    public String toString() {
        return "WebhookEvent{" +
                "event='" + event + '\'' +
                ", id='" + id + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}

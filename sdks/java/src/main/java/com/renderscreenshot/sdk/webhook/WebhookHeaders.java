package com.renderscreenshot.sdk.webhook;

/**
 * Signature, timestamp and id extracted from an inbound webhook request.
 * Absent headers are empty strings, never null.
 */
public class WebhookHeaders {

    private final String signature;
    private final String timestamp;
    private final String id;

    public WebhookHeaders(String signature, String timestamp, String id) {
        this.signature = signature != null ? signature : "";
        this.timestamp = timestamp != null ? timestamp : "";
        this.id = id != null ? id : "";
    }

    public String getSignature() {
        return signature;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public String getId() {
        return id;
    }

    /**
     * Returns true if both the signature and the timestamp are present.
     */
    public boolean isComplete() {
        return !signature.isEmpty() && !timestamp.isEmpty();
    }

    @Override
    public String toString() {
        return "WebhookHeaders{" +
                "timestamp='" + timestamp + '\'' +
                ", id='" + id + '\'' +
                '}';
    }
}

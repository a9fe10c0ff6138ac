package com.renderscreenshot.sdk.webhook;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.renderscreenshot.sdk.exceptions.ErrorCode;
import com.renderscreenshot.sdk.exceptions.RenderScreenshotException;
import com.renderscreenshot.sdk.signing.RequestSigner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Verifies and parses webhooks sent by RenderScreenshot.
 *
 * <p>The signature header carries {@code sha256=<hex>} where the hex digest is
 * HMAC-SHA256 over {@code timestamp + "." + payload}, keyed with the webhook secret.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * WebhookHeaders headers = WebhookVerifier.extractHeaders(requestHeaders);
 * if (!WebhookVerifier.verify(body, headers.getSignature(), headers.getTimestamp(), secret)) {
 *     return 401;
 * }
 * WebhookEvent event = WebhookVerifier.parse(body);
 * }</pre>
 */
public final class WebhookVerifier {

    private static final Logger logger = LoggerFactory.getLogger(WebhookVerifier.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final String ID_HEADER = "X-Webhook-ID";
    public static final Duration DEFAULT_TOLERANCE = Duration.ofSeconds(300);

    private static final String SIGNATURE_PREFIX = "sha256=";

    private WebhookVerifier() {
    }

    /**
     * Verifies a webhook signature using the default five minute tolerance.
     */
    public static boolean verify(String payload, String signature, String timestamp, String secret) {
        return verify(payload, signature, timestamp, secret, DEFAULT_TOLERANCE);
    }

    /**
     * Verifies a webhook signature.
     *
     * @param payload   raw request body
     * @param signature value of the signature header
     * @param timestamp value of the timestamp header, unix seconds
     * @param secret    webhook signing secret
     * @param tolerance maximum distance between the timestamp and now, in either direction;
     *                  null or zero selects {@link #DEFAULT_TOLERANCE}; timestamps are whole
     *                  seconds, so any other value must be at least one second
     * @return true only if the timestamp is within tolerance and the signature matches
     * @throws IllegalArgumentException if the tolerance is negative or below one second
     */
    public static boolean verify(String payload, String signature, String timestamp, String secret,
                                 Duration tolerance) {
        return verify(payload, signature, timestamp, secret, tolerance, Clock.systemUTC());
    }

    static boolean verify(String payload, String signature, String timestamp, String secret,
                          Duration tolerance, Clock clock) {
        if (tolerance == null || tolerance.isZero()) {
            tolerance = DEFAULT_TOLERANCE;
        }
        if (tolerance.isNegative() || tolerance.getSeconds() == 0) {
            throw new IllegalArgumentException("tolerance must be at least one second: " + tolerance);
        }

        if (isEmpty(payload) || isEmpty(signature) || isEmpty(timestamp) || isEmpty(secret)) {
            return false;
        }

        long sentAt;
        try {
            sentAt = Long.parseLong(timestamp);
        } catch (NumberFormatException e) {
            logger.debug("Rejecting webhook: malformed timestamp");
            return false;
        }

        long age = clock.instant().getEpochSecond() - sentAt;
        long toleranceSeconds = tolerance.getSeconds();
        if (age > toleranceSeconds || age < -toleranceSeconds) {
            logger.debug("Rejecting webhook: timestamp outside the {}s tolerance window", toleranceSeconds);
            return false;
        }

        String expected = SIGNATURE_PREFIX + RequestSigner.sign(timestamp + "." + payload, secret);
        boolean valid = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                signature.getBytes(StandardCharsets.UTF_8));
        if (!valid) {
            logger.debug("Rejecting webhook: signature mismatch");
        }
        return valid;
    }

    /**
     * Parses a webhook payload. The event type is read from {@code type}, falling back to
     * {@code event}.
     *
     * @throws RenderScreenshotException with code {@code invalid_request} if the payload is not
     *                                   a JSON object
     */
    public static WebhookEvent parse(String payload) {
        Map<String, Object> raw;
        try {
            raw = payload != null ? objectMapper.readValue(payload, MAP_TYPE) : null;
        } catch (IOException e) {
            throw new RenderScreenshotException("Invalid webhook payload: " + e.getMessage(), 400,
                    ErrorCode.INVALID_REQUEST, e);
        }
        if (raw == null) {
            throw new RenderScreenshotException("Invalid webhook payload: empty", 400, ErrorCode.INVALID_REQUEST);
        }

        String event = null;
        if (raw.get("type") instanceof String) {
            event = (String) raw.get("type");
        } else if (raw.get("event") instanceof String) {
            event = (String) raw.get("event");
        }

        String id = raw.get("id") instanceof String ? (String) raw.get("id") : null;
        long timestamp = raw.get("timestamp") instanceof Number ? ((Number) raw.get("timestamp")).longValue() : 0L;

        Map<String, Object> data = new LinkedHashMap<>();
        if (raw.get("data") instanceof Map) {
            @SuppressWarnings("unchecked")
            Map<String, Object> dataMap = (Map<String, Object>) raw.get("data");
            data.putAll(dataMap);
        }

        return new WebhookEvent(event, id, timestamp, data);
    }

    /**
     * Extracts the webhook headers regardless of casing or separator, so
     * {@code X-Webhook-Signature}, {@code x-webhook-signature} and {@code X_WEBHOOK_SIGNATURE}
     * all match. Missing headers come back as empty strings.
     */
    public static WebhookHeaders extractHeaders(Map<String, String> headers) {
        Map<String, String> normalized = new HashMap<>();
        if (headers != null) {
            headers.forEach((name, value) -> normalized.put(normalize(name), value));
        }
        return new WebhookHeaders(
                normalized.get(normalize(SIGNATURE_HEADER)),
                normalized.get(normalize(TIMESTAMP_HEADER)),
                normalized.get(normalize(ID_HEADER)));
    }

    private static String normalize(String name) {
        return name.replace('_', '-').toLowerCase(Locale.ROOT);
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}

package com.renderscreenshot.sdk.webhook;

import com.renderscreenshot.sdk.exceptions.ErrorCode;
import com.renderscreenshot.sdk.exceptions.RenderScreenshotException;
import com.renderscreenshot.sdk.signing.RequestSigner;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WebhookVerifierTest {

    private static final String SECRET = "whsec_test";
    private static final String PAYLOAD = "{\"type\":\"screenshot.completed\",\"id\":\"evt_1\",\"timestamp\":1735689600,"
            + "\"data\":{\"screenshot_id\":\"scr_1\",\"image_url\":\"https://cdn.example.com/scr_1.png\"}}";

    private static String sign(String timestamp, String payload) {
        return "sha256=" + RequestSigner.sign(timestamp + "." + payload, SECRET);
    }

    private static String now(long offsetSeconds) {
        return Long.toString(Instant.now().getEpochSecond() + offsetSeconds);
    }

    @Test
    void testValidSignature() {
        String timestamp = now(0);

        assertTrue(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET));
    }

    @Test
    void testAlteredSignatureIsRejected() {
        String timestamp = now(0);
        char[] signature = sign(timestamp, PAYLOAD).toCharArray();
        int last = signature.length - 1;
        signature[last] = signature[last] == 'a' ? 'b' : 'a';

        assertFalse(WebhookVerifier.verify(PAYLOAD, new String(signature), timestamp, SECRET));
    }

    @Test
    void testAlteredPayloadIsRejected() {
        String timestamp = now(0);

        assertFalse(WebhookVerifier.verify(PAYLOAD + " ", sign(timestamp, PAYLOAD), timestamp, SECRET));
    }

    @Test
    void testWrongSecretIsRejected() {
        String timestamp = now(0);

        assertFalse(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, "whsec_other"));
    }

    @Test
    void testSignatureWithoutPrefixIsRejected() {
        String timestamp = now(0);
        String bare = RequestSigner.sign(timestamp + "." + PAYLOAD, SECRET);

        assertFalse(WebhookVerifier.verify(PAYLOAD, bare, timestamp, SECRET));
    }

    @Test
    void testStaleTimestampIsRejected() {
        String timestamp = now(-600);

        assertFalse(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET,
                Duration.ofSeconds(300)));
    }

    @Test
    void testTimestampWithinCustomTolerance() {
        String timestamp = now(-120);

        assertTrue(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET,
                Duration.ofSeconds(180)));
    }

    @Test
    void testFutureTimestampIsRejected() {
        String timestamp = now(600);

        assertFalse(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET));
    }

    @Test
    void testToleranceBoundaryWithFixedClock() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_000_000L), ZoneOffset.UTC);
        String edge = Long.toString(1_000_000L - 300);
        String past = Long.toString(1_000_000L - 301);

        assertTrue(WebhookVerifier.verify(PAYLOAD, sign(edge, PAYLOAD), edge, SECRET, Duration.ofSeconds(300), clock));
        assertFalse(WebhookVerifier.verify(PAYLOAD, sign(past, PAYLOAD), past, SECRET, Duration.ofSeconds(300), clock));
    }

    @Test
    void testZeroToleranceUsesDefault() {
        String timestamp = now(-200);

        assertTrue(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET, Duration.ZERO));
        assertTrue(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET, null));
    }

    @Test
    void testEmptyArgumentsAreRejected() {
        String timestamp = now(0);
        String signature = sign(timestamp, PAYLOAD);

        assertFalse(WebhookVerifier.verify("", signature, timestamp, SECRET));
        assertFalse(WebhookVerifier.verify(PAYLOAD, "", timestamp, SECRET));
        assertFalse(WebhookVerifier.verify(PAYLOAD, signature, "", SECRET));
        assertFalse(WebhookVerifier.verify(PAYLOAD, signature, timestamp, ""));
        assertFalse(WebhookVerifier.verify(null, null, null, null));
    }

    @Test
    void testMalformedTimestampIsRejected() {
        assertFalse(WebhookVerifier.verify(PAYLOAD, sign("yesterday", PAYLOAD), "yesterday", SECRET));
    }

    @Test
    void testExtractHeadersAcceptsAnyConvention() {
        WebhookHeaders standard = WebhookVerifier.extractHeaders(Map.of(
                "X-Webhook-Signature", "sha256=abc",
                "X-Webhook-Timestamp", "1735689600",
                "X-Webhook-ID", "evt_1"));
        WebhookHeaders lower = WebhookVerifier.extractHeaders(Map.of(
                "x-webhook-signature", "sha256=abc",
                "x-webhook-timestamp", "1735689600",
                "x-webhook-id", "evt_1"));
        WebhookHeaders underscored = WebhookVerifier.extractHeaders(Map.of(
                "X_WEBHOOK_SIGNATURE", "sha256=abc",
                "x_webhook_timestamp", "1735689600",
                "X_Webhook_Id", "evt_1"));

        for (WebhookHeaders headers : new WebhookHeaders[]{standard, lower, underscored}) {
            assertEquals("sha256=abc", headers.getSignature());
            assertEquals("1735689600", headers.getTimestamp());
            assertEquals("evt_1", headers.getId());
            assertTrue(headers.isComplete());
        }
    }

    @Test
    void testExtractHeadersMissingAreEmpty() {
        WebhookHeaders headers = WebhookVerifier.extractHeaders(Map.of("Content-Type", "application/json"));

        assertEquals("", headers.getSignature());
        assertEquals("", headers.getTimestamp());
        assertEquals("", headers.getId());
        assertFalse(headers.isComplete());
        assertFalse(WebhookVerifier.extractHeaders(null).isComplete());
    }

    @Test
    void testParse() {
        WebhookEvent event = WebhookVerifier.parse(PAYLOAD);

        assertEquals("screenshot.completed", event.getEvent());
        assertEquals("evt_1", event.getId());
        assertEquals(1735689600L, event.getTimestamp());
        assertEquals(Instant.ofEpochSecond(1735689600L), event.getTime());
        assertEquals("scr_1", event.getData().get("screenshot_id"));
    }

    @Test
    void testParseFallsBackToEventField() {
        WebhookEvent event = WebhookVerifier.parse("{\"event\":\"batch.completed\",\"id\":\"evt_2\"}");

        assertEquals("batch.completed", event.getEvent());
        assertEquals(0L, event.getTimestamp());
        assertNotNull(event.getData());
        assertTrue(event.getData().isEmpty());
    }

    @Test
    void testParseInvalidPayload() {
        RenderScreenshotException ex = assertThrows(RenderScreenshotException.class,
                () -> WebhookVerifier.parse("not json"));

        assertEquals(ErrorCode.INVALID_REQUEST, ex.getCode());
        assertEquals(400, ex.getStatusCode());
    }

    @Test
    void testVerifyThenParse() {
        String timestamp = now(-5);
        Map<String, String> requestHeaders = Map.of(
                "x-webhook-signature", sign(timestamp, PAYLOAD),
                "x-webhook-timestamp", timestamp,
                "x-webhook-id", "evt_1");

        WebhookHeaders headers = WebhookVerifier.extractHeaders(requestHeaders);
        assertTrue(WebhookVerifier.verify(PAYLOAD, headers.getSignature(), headers.getTimestamp(), SECRET));
        assertEquals(headers.getId(), WebhookVerifier.parse(PAYLOAD).getId());
    }

    @Test
    void testSubSecondToleranceIsRejected() {
        String timestamp = now(0);
        String signature = sign(timestamp, PAYLOAD);

        assertThrows(IllegalArgumentException.class,
                () -> WebhookVerifier.verify(PAYLOAD, signature, timestamp, SECRET, Duration.ofMillis(500)));
        assertThrows(IllegalArgumentException.class,
                () -> WebhookVerifier.verify(PAYLOAD, signature, timestamp, SECRET, Duration.ofSeconds(-5)));
    }

    @Test
    void testFractionalToleranceUsesWholeSeconds() {
        Clock clock = Clock.fixed(Instant.ofEpochSecond(1_000_000L), ZoneOffset.UTC);
        String timestamp = Long.toString(1_000_000L - 1);

        assertTrue(WebhookVerifier.verify(PAYLOAD, sign(timestamp, PAYLOAD), timestamp, SECRET,
                Duration.ofMillis(1500), clock));
    }
}

package com.renderscreenshot.sdk.exceptions;

import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RenderScreenshotExceptionTest {

    @Test
    void testRetryableCodes() {
        Set<ErrorCode> retryable = EnumSet.of(
                ErrorCode.RATE_LIMITED,
                ErrorCode.TIMEOUT,
                ErrorCode.RENDER_FAILED,
                ErrorCode.INTERNAL_ERROR,
                ErrorCode.CONNECTION_ERROR);

        for (ErrorCode code : ErrorCode.values()) {
            RenderScreenshotException ex = new RenderScreenshotException("failed", 0, code);
            assertEquals(retryable.contains(code), ex.isRetryable(), code.getValue());
        }
    }

    @Test
    void testAnyServerStatusIsRetryable() {
        RenderScreenshotException ex = new RenderScreenshotException("bad gateway", 502, "upstream_gone", null, 0);

        assertTrue(ex.isRetryable());
        assertTrue(ex.isServerError());
    }

    @Test
    void testClientErrorsAreNotRetryable() {
        assertFalse(new RenderScreenshotException("x", 400, ErrorCode.INVALID_REQUEST).isRetryable());
        assertFalse(new RenderScreenshotException("x", 401, ErrorCode.UNAUTHORIZED).isRetryable());
        assertFalse(new RenderScreenshotException("x", 403, ErrorCode.FORBIDDEN).isRetryable());
        assertFalse(new RenderScreenshotException("x", 404, ErrorCode.NOT_FOUND).isRetryable());
        assertFalse(new RenderScreenshotException("x", 402, ErrorCode.INSUFFICIENT_CREDITS).isRetryable());
    }

    @Test
    void testPredicates() {
        RenderScreenshotException notFound = new RenderScreenshotException("gone", 0, ErrorCode.NOT_FOUND);
        assertTrue(notFound.isNotFound());

        RenderScreenshotException auth = new RenderScreenshotException("who", 401, ErrorCode.INVALID_API_KEY);
        assertTrue(auth.isAuthentication());
        assertFalse(auth.isValidation());

        RenderScreenshotException validation = new RenderScreenshotException("bad", 400, ErrorCode.MISSING_REQUIRED);
        assertTrue(validation.isValidation());
    }

    @Test
    void testNegativeRetryAfterIsClampedToZero() {
        RenderScreenshotException ex = new RenderScreenshotException("slow down", 429, "rate_limited", null, -3);

        assertEquals(0, ex.getRetryAfter());
    }

    @Test
    void testToStringIncludesCorrelationData() {
        RenderScreenshotException ex = new RenderScreenshotException("slow down", 429, "rate_limited", "req_1", 60);

        String text = ex.toString();
        assertTrue(text.contains("statusCode=429"));
        assertTrue(text.contains("errorCode='rate_limited'"));
        assertTrue(text.contains("requestId='req_1'"));
        assertTrue(text.contains("retryAfter=60"));
    }

    @Test
    void testFromValue() {
        assertEquals(ErrorCode.EXPIRED_SIGNATURE, ErrorCode.fromValue("expired_signature"));
        assertNull(ErrorCode.fromValue("nope"));
        assertNull(ErrorCode.fromValue(null));
    }
}

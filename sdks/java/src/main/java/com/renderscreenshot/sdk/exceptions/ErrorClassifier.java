package com.renderscreenshot.sdk.exceptions;

import java.util.Map;

/**
 * Maps an HTTP error response to a {@link RenderScreenshotException}.
 */
public final class ErrorClassifier {

    private ErrorClassifier() {
    }

    /**
     * Classifies an error response.
     *
     * @param statusCode       the HTTP status code
     * @param body             the parsed response body, may be empty or null
     * @param retryAfterHeader value of the {@code Retry-After} header, may be null
     * @param requestIdHeader  value of the {@code X-Request-Id} header, may be null
     * @return the typed error, never null
     */
    public static RenderScreenshotException classify(int statusCode, Map<String, Object> body,
                                                     String retryAfterHeader, String requestIdHeader) {
        String message = "HTTP " + statusCode + " error";
        String code = null;
        String requestId = isEmpty(requestIdHeader) ? null : requestIdHeader;

        Object errorObj = body != null ? body.get("error") : null;
        if (errorObj instanceof Map) {
            Map<?, ?> error = (Map<?, ?>) errorObj;
            if (error.get("message") instanceof String) {
                message = (String) error.get("message");
            }
            if (error.get("code") instanceof String) {
                code = (String) error.get("code");
            }
            if (isEmpty(requestId) && error.get("request_id") instanceof String) {
                requestId = emptyToNull((String) error.get("request_id"));
            }
        }

        if (isEmpty(requestId) && body != null && body.get("request_id") instanceof String) {
            requestId = emptyToNull((String) body.get("request_id"));
        }

        if (isEmpty(code)) {
            ErrorCode inferred = inferCode(statusCode);
            code = inferred != null ? inferred.getValue() : null;
        }

        return new RenderScreenshotException(message, statusCode, code, requestId,
                parseRetryAfter(retryAfterHeader));
    }

    /**
     * Infers an error code from the HTTP status alone. Returns null for unmapped statuses.
     */
    public static ErrorCode inferCode(int statusCode) {
        switch (statusCode) {
            case 400:
            case 422:
                return ErrorCode.INVALID_REQUEST;
            case 401:
                return ErrorCode.UNAUTHORIZED;
            case 403:
                return ErrorCode.FORBIDDEN;
            case 404:
                return ErrorCode.NOT_FOUND;
            case 408:
                return ErrorCode.TIMEOUT;
            case 429:
                return ErrorCode.RATE_LIMITED;
            default:
                return statusCode >= 500 ? ErrorCode.INTERNAL_ERROR : null;
        }
    }

    /**
     * Parses a {@code Retry-After} header in delta-seconds form. Anything that is not a
     * non-negative integer yields 0.
     */
    public static int parseRetryAfter(String value) {
        if (isEmpty(value)) {
            return 0;
        }
        try {
            int seconds = Integer.parseInt(value.trim());
            return Math.max(seconds, 0);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static String emptyToNull(String value) {
        return isEmpty(value) ? null : value;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}

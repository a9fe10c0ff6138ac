package com.renderscreenshot.sdk.exceptions;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Machine-readable error codes returned by the RenderScreenshot API.
 */
public enum ErrorCode {
    INVALID_URL("invalid_url"),
    INVALID_REQUEST("invalid_request"),
    MISSING_REQUIRED("missing_required"),
    UNAUTHORIZED("unauthorized"),
    INVALID_API_KEY("invalid_api_key"),
    EXPIRED_SIGNATURE("expired_signature"),
    FORBIDDEN("forbidden"),
    INSUFFICIENT_CREDITS("insufficient_credits"),
    NOT_FOUND("not_found"),
    RATE_LIMITED("rate_limited"),
    TIMEOUT("timeout"),
    RENDER_FAILED("render_failed"),
    INTERNAL_ERROR("internal_error"),
    CONNECTION_ERROR("connection_error");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Returns the code with the given wire value, or {@code null} if it is not a known code.
     */
    public static ErrorCode fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ErrorCode code : values()) {
            if (code.value.equals(value)) {
                return code;
            }
        }
        return null;
    }
}

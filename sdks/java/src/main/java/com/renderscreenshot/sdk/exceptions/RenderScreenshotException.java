package com.renderscreenshot.sdk.exceptions;

import java.util.EnumSet;
import java.util.Set;

/**
 * The single error type raised by the RenderScreenshot SDK.
 *
 * <p>Carries the HTTP status (0 when the server was never reached), the machine-readable
 * error code, the request id for support correlation and the server's retry-after hint.</p>
 */
public class RenderScreenshotException extends RuntimeException {

    private static final Set<ErrorCode> RETRYABLE_CODES = EnumSet.of(
            ErrorCode.RATE_LIMITED,
            ErrorCode.TIMEOUT,
            ErrorCode.RENDER_FAILED,
            ErrorCode.INTERNAL_ERROR,
            ErrorCode.CONNECTION_ERROR);

    private final int statusCode;
    private final String errorCode;
    private final String requestId;
    private final int retryAfter;

    public RenderScreenshotException(String message, ErrorCode code) {
        this(message, 0, code, null);
    }

    public RenderScreenshotException(String message, int statusCode, ErrorCode code) {
        this(message, statusCode, code, null);
    }

    public RenderScreenshotException(String message, int statusCode, ErrorCode code, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = code != null ? code.getValue() : null;
        this.requestId = null;
        this.retryAfter = 0;
    }

    public RenderScreenshotException(String message, int statusCode, String errorCode, String requestId, int retryAfter) {
        super(message);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.requestId = requestId;
        this.retryAfter = Math.max(retryAfter, 0);
    }

    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Returns the raw error code as sent by the server or assigned by the SDK.
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Returns the error code as a known constant, or {@code null} if absent or unrecognised.
     */
    public ErrorCode getCode() {
        return ErrorCode.fromValue(errorCode);
    }

    public String getRequestId() {
        return requestId;
    }

    /**
     * Returns the number of seconds the server asked us to wait, or 0 if it gave no hint.
     */
    public int getRetryAfter() {
        return retryAfter;
    }

    public boolean isNotFound() {
        return statusCode == 404 || getCode() == ErrorCode.NOT_FOUND;
    }

    public boolean isRateLimited() {
        return statusCode == 429 || getCode() == ErrorCode.RATE_LIMITED;
    }

    public boolean isAuthentication() {
        return statusCode == 401;
    }

    public boolean isValidation() {
        return statusCode == 400 || (statusCode == 422 && getCode() != ErrorCode.RENDER_FAILED);
    }

    public boolean isServerError() {
        return statusCode >= 500 && statusCode < 600;
    }

    /**
     * Returns true if the failure is transient and the same request may succeed later.
     * Client errors such as validation or authentication failures are never retryable.
     */
    public boolean isRetryable() {
        ErrorCode code = getCode();
        return (code != null && RETRYABLE_CODES.contains(code)) || isServerError();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("RenderScreenshotException{");
        sb.append("message='").append(getMessage()).append('\'');
        if (statusCode > 0) {
            sb.append(", statusCode=").append(statusCode);
        }
        if (errorCode != null) {
            sb.append(", errorCode='").append(errorCode).append('\'');
        }
        if (requestId != null) {
            sb.append(", requestId='").append(requestId).append('\'');
        }
        if (retryAfter > 0) {
            sb.append(", retryAfter=").append(retryAfter);
        }
        sb.append('}');
        return sb.toString();
    }
}

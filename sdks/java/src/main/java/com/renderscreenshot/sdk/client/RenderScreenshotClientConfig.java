package com.renderscreenshot.sdk.client;

import com.renderscreenshot.sdk.exceptions.ErrorCode;
import com.renderscreenshot.sdk.exceptions.RenderScreenshotException;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for the RenderScreenshot client.
 */
public class RenderScreenshotClientConfig {

    public static final String DEFAULT_BASE_URL = "https://api.renderscreenshot.com";

    private final String apiKey;
    private final String baseUrl;
    private final Duration timeout;
    private final int maxRetries;
    private final Duration retryDelay;
    private final String signingKey;
    private final String publicKeyId;

    private RenderScreenshotClientConfig(Builder builder) {
        this.apiKey = builder.apiKey;
        this.baseUrl = trimTrailingSlashes(builder.baseUrl);
        this.timeout = builder.timeout;
        this.maxRetries = builder.maxRetries;
        this.retryDelay = builder.retryDelay;
        this.signingKey = builder.signingKey;
        this.publicKeyId = builder.publicKeyId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getRetryDelay() {
        return retryDelay;
    }

    public String getSigningKey() {
        return signingKey;
    }

    public String getPublicKeyId() {
        return publicKeyId;
    }

    private static String trimTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    /**
     * Builder for creating RenderScreenshotClientConfig instances.
     *
     * <p>Defaults: base URL {@value #DEFAULT_BASE_URL}, 30 second timeout, no retries,
     * 1 second base retry delay.</p>
     */
    public static class Builder {
        private String apiKey;
        private String baseUrl = DEFAULT_BASE_URL;
        private Duration timeout = Duration.ofSeconds(30);
        private int maxRetries = 0;
        private Duration retryDelay = Duration.ofSeconds(1);
        private String signingKey;
        private String publicKeyId;

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl must not be null");
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
            return this;
        }

        /**
         * Sets how many times a retryable failure is retried. 0 disables retries.
         */
        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        /**
         * Sets the base delay for exponential backoff.
         */
        public Builder retryDelay(Duration retryDelay) {
            this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay must not be null");
            return this;
        }

        /**
         * Sets the secret key ({@code rs_secret_*}) used to sign URLs.
         */
        public Builder signingKey(String signingKey) {
            this.signingKey = signingKey;
            return this;
        }

        /**
         * Sets the public key id ({@code rs_pub_*}) embedded in signed URLs.
         */
        public Builder publicKeyId(String publicKeyId) {
            this.publicKeyId = publicKeyId;
            return this;
        }

        public RenderScreenshotClientConfig build() {
            if (apiKey == null || apiKey.isEmpty()) {
                throw new RenderScreenshotException("Invalid or missing API key", 401, ErrorCode.UNAUTHORIZED);
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("maxRetries must not be negative");
            }
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("retryDelay must not be negative");
            }
            return new RenderScreenshotClientConfig(this);
        }
    }
}

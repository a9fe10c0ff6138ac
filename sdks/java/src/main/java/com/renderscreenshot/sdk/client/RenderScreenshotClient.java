package com.renderscreenshot.sdk.client;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.renderscreenshot.sdk.exceptions.ErrorCode;
import com.renderscreenshot.sdk.exceptions.RenderScreenshotException;
import com.renderscreenshot.sdk.signing.RequestSigner;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Main client for the RenderScreenshot API.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RenderScreenshotClient client = RenderScreenshotClient.builder()
 *     .apiKey("rs_live_your_api_key")
 *     .maxRetries(3)
 *     .build();
 *
 * byte[] png = client.take(Map.of("url", "https://example.com", "width", 1200));
 *
 * client.close();
 * }</pre>
 */
public class RenderScreenshotClient implements AutoCloseable {

    public static final String VERSION = "1.0.0";

    private static final String SCREENSHOT_PATH = "/v1/screenshot";
    private static final String BATCH_PATH = "/v1/batch";

    private final RenderScreenshotClientConfig config;
    private final HttpTransport transport;
    private volatile CacheManager cacheManager;

    private RenderScreenshotClient(RenderScreenshotClientConfig config) {
        this.config = config;

        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

        this.transport = new HttpTransport(config, objectMapper);
    }

    /**
     * Creates a new client builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a new client with default settings.
     */
    public static RenderScreenshotClient withApiKey(String apiKey) {
        return builder()
                .apiKey(apiKey)
                .build();
    }

    public RenderScreenshotClientConfig getConfig() {
        return config;
    }

    // ================================
    // Screenshot Methods
    // ================================

    /**
     * Captures a screenshot and returns the image or PDF bytes.
     */
    public byte[] take(Map<String, Object> params) {
        return takeWithMetadata(params).getBody();
    }

    /**
     * Captures a screenshot and returns the bytes along with the response headers.
     */
    public BinaryResponse takeWithMetadata(Map<String, Object> params) {
        return transport.postBinary(SCREENSHOT_PATH, params, null);
    }

    /**
     * Captures a screenshot asynchronously.
     */
    public CompletableFuture<byte[]> takeAsync(Map<String, Object> params) {
        return CompletableFuture.supplyAsync(() -> take(params));
    }

    /**
     * Captures a screenshot and returns the JSON response with metadata.
     */
    public Map<String, Object> takeJson(Map<String, Object> params) {
        return transport.post(SCREENSHOT_PATH, params, Map.of("Accept", "application/json"));
    }

    /**
     * Captures a screenshot asynchronously, returning the JSON response.
     */
    public CompletableFuture<Map<String, Object>> takeJsonAsync(Map<String, Object> params) {
        return CompletableFuture.supplyAsync(() -> takeJson(params));
    }

    // ================================
    // Signed URL Methods
    // ================================

    /**
     * Generates a signed screenshot URL using the configured signing credentials.
     */
    public String generateUrl(Map<String, String> params, Instant expiresAt) {
        return generateUrl(params, expiresAt, null, null);
    }

    /**
     * Generates a signed screenshot URL that can be used client-side without exposing the
     * API key. Explicit credentials take precedence over the configured ones.
     *
     * @param params      flattened screenshot parameters
     * @param expiresAt   expiry of the URL
     * @param signingKey  secret key ({@code rs_secret_*}), or null for the configured one
     * @param publicKeyId public key id ({@code rs_pub_*}), or null for the configured one
     * @throws RenderScreenshotException with code {@code invalid_request} if no key pair is available
     */
    public String generateUrl(Map<String, String> params, Instant expiresAt, String signingKey, String publicKeyId) {
        String secret = isEmpty(signingKey) ? config.getSigningKey() : signingKey;
        String keyId = isEmpty(publicKeyId) ? config.getPublicKeyId() : publicKeyId;

        if (isEmpty(secret) || isEmpty(keyId)) {
            throw new RenderScreenshotException(
                    "Signed URLs require signingKey (rs_secret_*) and publicKeyId (rs_pub_*). "
                            + "Configure them on the client or pass them to generateUrl directly.",
                    400, ErrorCode.INVALID_REQUEST);
        }

        return RequestSigner.signUrl(config.getBaseUrl(), SCREENSHOT_PATH, params, expiresAt, keyId, secret);
    }

    // ================================
    // Batch Methods
    // ================================

    /**
     * Captures several URLs with the same options.
     */
    public Map<String, Object> batch(List<String> urls, Map<String, Object> options) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("urls", urls);
        if (options != null) {
            body.put("options", options);
        }
        return transport.post(BATCH_PATH, body, null);
    }

    /**
     * Captures several URLs, each with its own options. Every request must contain a
     * {@code url} entry.
     */
    public Map<String, Object> batchAdvanced(List<Map<String, Object>> requests) {
        return transport.post(BATCH_PATH, Map.of("requests", requests), null);
    }

    /**
     * Gets the status of a batch job.
     */
    public Map<String, Object> getBatch(String batchId) {
        return transport.get(BATCH_PATH + "/" + batchId, null, null);
    }

    // ================================
    // Account Methods
    // ================================

    /**
     * Lists the available screenshot presets.
     */
    public List<Map<String, Object>> presets() {
        return listUnder(transport.get("/v1/presets", null, null), "presets");
    }

    /**
     * Gets a preset by id.
     */
    public Map<String, Object> preset(String presetId) {
        return transport.get("/v1/presets/" + presetId, null, null);
    }

    /**
     * Lists the available device presets.
     */
    public List<Map<String, Object>> devices() {
        return listUnder(transport.get("/v1/devices", null, null), "devices");
    }

    /**
     * Gets usage and credit information for the account.
     */
    public Map<String, Object> usage() {
        return transport.get("/v1/usage", null, null);
    }

    /**
     * Returns the cache manager owned by this client.
     */
    public CacheManager cache() {
        CacheManager result = cacheManager;
        if (result == null) {
            synchronized (this) {
                result = cacheManager;
                if (result == null) {
                    result = new CacheManager(transport);
                    cacheManager = result;
                }
            }
        }
        return result;
    }

    @Override
    public void close() {
        transport.close();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> listUnder(Map<String, Object> response, String field) {
        List<Map<String, Object>> items = new ArrayList<>();
        Object value = response.get(field);
        if (value instanceof List) {
            for (Object item : (List<Object>) value) {
                if (item instanceof Map) {
                    items.add((Map<String, Object>) item);
                }
            }
        }
        return items;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    /**
     * Builder for creating RenderScreenshotClient instances.
     */
    public static class Builder {
        private final RenderScreenshotClientConfig.Builder configBuilder = RenderScreenshotClientConfig.builder();

        public Builder apiKey(String apiKey) {
            configBuilder.apiKey(apiKey);
            return this;
        }

        public Builder baseUrl(String baseUrl) {
            configBuilder.baseUrl(baseUrl);
            return this;
        }

        public Builder timeout(Duration timeout) {
            configBuilder.timeout(timeout);
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            configBuilder.maxRetries(maxRetries);
            return this;
        }

        public Builder retryDelay(Duration retryDelay) {
            configBuilder.retryDelay(retryDelay);
            return this;
        }

        public Builder signingKey(String signingKey) {
            configBuilder.signingKey(signingKey);
            return this;
        }

        public Builder publicKeyId(String publicKeyId) {
            configBuilder.publicKeyId(publicKeyId);
            return this;
        }

        public RenderScreenshotClient build() {
            return new RenderScreenshotClient(configBuilder.build());
        }
    }
}

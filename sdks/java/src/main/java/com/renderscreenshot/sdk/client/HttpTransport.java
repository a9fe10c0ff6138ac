package com.renderscreenshot.sdk.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.renderscreenshot.sdk.exceptions.ErrorClassifier;
import com.renderscreenshot.sdk.exceptions.ErrorCode;
import com.renderscreenshot.sdk.exceptions.RenderScreenshotException;
import okhttp3.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * HTTP transport for the RenderScreenshot API.
 *
 * <p>Each call applies authentication and timeouts, classifies failures into
 * {@link RenderScreenshotException} and retries retryable failures with exponential backoff
 * and jitter, up to the configured number of retries. A server-supplied {@code Retry-After}
 * takes precedence over the computed backoff.</p>
 *
 * <p>Instances are safe for concurrent use. Retries within one call are sequential and block
 * the calling thread for the backoff delay.</p>
 */
public class HttpTransport implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);
    private static final MediaType JSON = MediaType.parse("application/json");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static final String USER_AGENT = "renderscreenshot-java/" + RenderScreenshotClient.VERSION;
    static final Duration MAX_RETRY_DELAY = Duration.ofSeconds(30);

    private final RenderScreenshotClientConfig config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Sleeper sleeper;

    public HttpTransport(RenderScreenshotClientConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, delay -> Thread.sleep(delay.toMillis()));
    }

    HttpTransport(RenderScreenshotClientConfig config, ObjectMapper objectMapper, Sleeper sleeper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.sleeper = sleeper;

        long timeoutMillis = config.getTimeout().toMillis();
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .readTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .writeTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                .callTimeout(timeoutMillis, TimeUnit.MILLISECONDS)
                // attempts are counted here, not inside OkHttp
                .retryOnConnectionFailure(false)
                .build();
    }

    public Map<String, Object> get(String path, Map<String, String> params, Map<String, String> headers) {
        return requestJson("GET", path, params, null, headers);
    }

    public BinaryResponse getBinary(String path, Map<String, String> params, Map<String, String> headers) {
        return executeWithRetry("GET", path, params, null, headers);
    }

    public Map<String, Object> post(String path, Object body, Map<String, String> headers) {
        return requestJson("POST", path, null, body, headers);
    }

    public BinaryResponse postBinary(String path, Object body, Map<String, String> headers) {
        return executeWithRetry("POST", path, null, body, headers);
    }

    public Map<String, Object> delete(String path, Map<String, String> params, Map<String, String> headers) {
        return requestJson("DELETE", path, params, null, headers);
    }

    private Map<String, Object> requestJson(String method, String path, Map<String, String> params,
                                            Object body, Map<String, String> headers) {
        BinaryResponse response = executeWithRetry(method, path, params, body, headers);
        return parseSuccessBody(response.getBody());
    }

    private BinaryResponse executeWithRetry(String method, String path, Map<String, String> params,
                                            Object body, Map<String, String> headers) {
        int maxRetries = config.getMaxRetries();

        for (int attempt = 0; ; attempt++) {
            try {
                return doRequest(method, path, params, body, headers);
            } catch (RenderScreenshotException e) {
                if (!e.isRetryable() || attempt >= maxRetries) {
                    throw e;
                }
                Duration delay = calculateDelay(e, attempt);
                logger.warn("Request {} {} failed (attempt {}/{}), retrying in {} ms: {}",
                        method, path, attempt + 1, maxRetries + 1, delay.toMillis(), e.getMessage());
                sleep(delay);
            }
        }
    }

    /**
     * Returns the wait before the next attempt. A positive retry-after hint is used as is;
     * otherwise {@code base * 2^attempt} plus up to half a base delay of jitter, capped at
     * {@link #MAX_RETRY_DELAY}.
     */
    Duration calculateDelay(RenderScreenshotException error, int attempt) {
        if (error.getRetryAfter() > 0) {
            return Duration.ofSeconds(error.getRetryAfter());
        }

        double baseMillis = config.getRetryDelay().toMillis();
        double jitter = ThreadLocalRandom.current().nextDouble() * baseMillis * 0.5;
        double delay = baseMillis * Math.pow(2, attempt) + jitter;
        return Duration.ofMillis((long) Math.min(delay, MAX_RETRY_DELAY.toMillis()));
    }

    private void sleep(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RenderScreenshotException("Request interrupted", 0, ErrorCode.CONNECTION_ERROR, e);
        }
    }

    private BinaryResponse doRequest(String method, String path, Map<String, String> params,
                                     Object body, Map<String, String> headers) {
        Request request = buildRequest(method, path, params, body, headers);
        logger.debug("{} {}", method, request.url());

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            byte[] bytes = responseBody != null ? responseBody.bytes() : new byte[0];

            if (response.code() >= 400) {
                throw ErrorClassifier.classify(response.code(), parseErrorBody(bytes),
                        response.header("Retry-After"), response.header("X-Request-Id"));
            }

            return new BinaryResponse(bytes, response.headers());
        } catch (InterruptedIOException e) {
            // OkHttp reports every timeout (connect, read, call) as an InterruptedIOException
            throw new RenderScreenshotException("Request timed out", 408, ErrorCode.TIMEOUT, e);
        } catch (IOException e) {
            throw new RenderScreenshotException("Failed to connect to server: " + e.getMessage(),
                    0, ErrorCode.CONNECTION_ERROR, e);
        }
    }

    private Request buildRequest(String method, String path, Map<String, String> params,
                                 Object body, Map<String, String> headers) {
        HttpUrl parsed = HttpUrl.parse(config.getBaseUrl() + path);
        if (parsed == null) {
            throw new RenderScreenshotException("Invalid request URL: " + config.getBaseUrl() + path,
                    ErrorCode.INVALID_URL);
        }

        HttpUrl.Builder urlBuilder = parsed.newBuilder();
        if (params != null) {
            params.forEach(urlBuilder::addQueryParameter);
        }

        Request.Builder requestBuilder = new Request.Builder()
                .url(urlBuilder.build())
                .header("Authorization", "Bearer " + config.getApiKey())
                .header("User-Agent", USER_AGENT);

        RequestBody requestBody = null;
        if (body != null) {
            try {
                requestBody = RequestBody.create(objectMapper.writeValueAsBytes(body), bodyMediaType(headers));
            } catch (JsonProcessingException e) {
                throw new RenderScreenshotException("Failed to serialize request body", 0,
                        ErrorCode.INVALID_REQUEST, e);
            }
            requestBuilder.header("Content-Type", "application/json");
        }

        if (headers != null) {
            headers.forEach(requestBuilder::header);
        }

        switch (method) {
            case "GET":
                requestBuilder.get();
                break;
            case "POST":
                requestBuilder.post(requestBody != null ? requestBody : RequestBody.create(new byte[0], (MediaType) null));
                break;
            case "DELETE":
                requestBuilder.delete(requestBody);
                break;
            default:
                throw new IllegalArgumentException("Unsupported HTTP method: " + method);
        }

        return requestBuilder.build();
    }

    /**
     * OkHttp sends the body's media type as {@code Content-Type}, so a caller-supplied value
     * has to be carried on the body itself. An unparseable caller value yields null, which
     * leaves the caller's header untouched.
     */
    private static MediaType bodyMediaType(Map<String, String> headers) {
        if (headers != null) {
            for (Map.Entry<String, String> header : headers.entrySet()) {
                if ("Content-Type".equalsIgnoreCase(header.getKey())) {
                    return MediaType.parse(header.getValue());
                }
            }
        }
        return JSON;
    }

    /**
     * Parses a 2xx body. An empty body is an empty map; anything that is not a JSON object is
     * handed back as text under {@code body} rather than failing the call.
     */
    private Map<String, Object> parseSuccessBody(byte[] bytes) {
        if (bytes.length == 0) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> result = objectMapper.readValue(bytes, MAP_TYPE);
            if (result != null) {
                return result;
            }
        } catch (IOException e) {
            logger.debug("Response body is not a JSON object, returning it as text: {}", e.getMessage());
        }
        Map<String, Object> fallback = new LinkedHashMap<>();
        fallback.put("body", new String(bytes, StandardCharsets.UTF_8));
        return fallback;
    }

    private Map<String, Object> parseErrorBody(byte[] bytes) {
        if (bytes.length == 0) {
            return Map.of();
        }
        try {
            Map<String, Object> result = objectMapper.readValue(bytes, MAP_TYPE);
            return result != null ? result : Map.of();
        } catch (IOException e) {
            logger.debug("Error response body is not a JSON object: {}", e.getMessage());
            return Map.of();
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }

    /**
     * Blocks the calling thread for a backoff delay.
     */
    @FunctionalInterface
    interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }
}

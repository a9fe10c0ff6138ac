package com.renderscreenshot.sdk.client;

import com.renderscreenshot.sdk.exceptions.RenderScreenshotException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operations on cached screenshots. Obtained from {@link RenderScreenshotClient#cache()}.
 */
public class CacheManager {

    private static final String PURGE_PATH = "/v1/cache/purge";

    private final HttpTransport transport;

    CacheManager(HttpTransport transport) {
        this.transport = transport;
    }

    /**
     * Gets a cached screenshot by key. Returns an empty optional if the key is not cached.
     */
    public Optional<byte[]> get(String key) {
        try {
            return Optional.of(transport.getBinary("/v1/cache/" + key, null, null).getBody());
        } catch (RenderScreenshotException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * Deletes a single cache entry. Returns false if the key was not cached.
     */
    public boolean delete(String key) {
        try {
            transport.delete("/v1/cache/" + key, null, null);
            return true;
        } catch (RenderScreenshotException e) {
            if (e.isNotFound()) {
                return false;
            }
            throw e;
        }
    }

    /**
     * Purges the given cache keys.
     */
    public Map<String, Object> purge(List<String> keys) {
        return transport.post(PURGE_PATH, Map.of("keys", keys), null);
    }

    /**
     * Purges entries whose source URL matches a glob pattern.
     */
    public Map<String, Object> purgeUrl(String pattern) {
        return transport.post(PURGE_PATH, Map.of("url", pattern), null);
    }

    /**
     * Purges entries created before the given instant. The instant is sent with second precision.
     */
    public Map<String, Object> purgeBefore(Instant before) {
        return transport.post(PURGE_PATH, Map.of("before", before.truncatedTo(ChronoUnit.SECONDS)), null);
    }

    /**
     * Purges entries whose storage path matches a pattern.
     */
    public Map<String, Object> purgePattern(String pattern) {
        return transport.post(PURGE_PATH, Map.of("pattern", pattern), null);
    }
}

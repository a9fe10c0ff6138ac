package com.renderscreenshot.sdk.signing;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * Signs screenshot parameters with HMAC-SHA256 so they can be embedded in a URL.
 *
 * <p>The parameters are serialized canonically: keys sorted lexicographically, values
 * form-encoded, joined as {@code key=value} pairs with {@code &}. Any two maps holding the
 * same pairs therefore produce the same signature.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * String url = RequestSigner.signUrl(
 *     "https://api.renderscreenshot.com", "/v1/screenshot",
 *     Map.of("url", "https://example.com", "width", "1200"),
 *     Instant.now().plus(Duration.ofHours(1)),
 *     "rs_pub_123", "rs_secret_456");
 * }</pre>
 */
public final class RequestSigner {

    private static final String ALGORITHM = "HmacSHA256";

    public static final String EXPIRES_PARAM = "expires";
    public static final String KEY_ID_PARAM = "key_id";
    public static final String SIGNATURE_PARAM = "signature";

    private RequestSigner() {
    }

    /**
     * Builds a signed URL of the form
     * {@code baseUrl + path + "?" + canonicalQuery + "&signature=" + hex}.
     *
     * @param baseUrl   API base URL without a trailing slash
     * @param path      request path, e.g. {@code /v1/screenshot}
     * @param params    flattened screenshot parameters
     * @param expiresAt when the URL stops being accepted
     * @param keyId     public key id ({@code rs_pub_*})
     * @param secret    signing secret ({@code rs_secret_*})
     * @return the signed URL
     */
    public static String signUrl(String baseUrl, String path, Map<String, String> params,
                                 Instant expiresAt, String keyId, String secret) {
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
        Objects.requireNonNull(keyId, "keyId must not be null");

        Map<String, String> signParams = new TreeMap<>();
        if (params != null) {
            signParams.putAll(params);
        }
        signParams.put(EXPIRES_PARAM, Long.toString(expiresAt.getEpochSecond()));
        signParams.put(KEY_ID_PARAM, keyId);

        String query = canonicalQuery(signParams);
        return baseUrl + path + "?" + query + "&" + SIGNATURE_PARAM + "=" + sign(query, secret);
    }

    /**
     * Serializes parameters in sorted key order with form-encoded values.
     */
    public static String canonicalQuery(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        new TreeMap<>(params).forEach((key, value) -> joiner.add(key + "=" + encode(value)));
        return joiner.toString();
    }

    /**
     * Returns the lowercase hex HMAC-SHA256 of {@code data} keyed with {@code secret}.
     *
     * @throws IllegalArgumentException if the secret is empty
     */
    public static String sign(String data, String secret) {
        Objects.requireNonNull(secret, "secret must not be null");
        if (secret.isEmpty()) {
            throw new IllegalArgumentException("secret must not be empty");
        }
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            byte[] digest = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute HMAC-SHA256", e);
        }
    }

    // Matches the server's query escaping: '*' is escaped and '~' is left alone.
    static String encode(String value) {
        return URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8)
                .replace("*", "%2A")
                .replace("%7E", "~");
    }
}

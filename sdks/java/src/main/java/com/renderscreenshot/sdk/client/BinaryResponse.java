package com.renderscreenshot.sdk.client;

import okhttp3.Headers;

/**
 * Raw response body together with the response headers, for binary endpoints.
 */
public class BinaryResponse {

    private final byte[] body;
    private final Headers headers;

    public BinaryResponse(byte[] body, Headers headers) {
        this.body = body;
        this.headers = headers;
    }

    public byte[] getBody() {
        return body;
    }

    public Headers getHeaders() {
        return headers;
    }

    /**
     * Returns the last value of the named header, or null if absent.
     */
    public String header(String name) {
        return headers.get(name);
    }

    @Override
    public String toString() {
        return "BinaryResponse{" +
                "bytes=" + body.length +
                ", contentType='" + header("Content-Type") + '\'' +
                '}';
    }
}

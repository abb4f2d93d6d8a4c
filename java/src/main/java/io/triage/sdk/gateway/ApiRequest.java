package io.triage.sdk.gateway;

import java.util.Locale;
import java.util.Objects;

/**
 * Outbound call relative to the gateway base URL. {@code retried} marks a request already replayed after a refresh;
 * such a request is never queued for another refresh.
 */
public record ApiRequest(String method, String path, Object body, boolean retried) {

    public ApiRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        if (!path.startsWith("/")) {
            throw new IllegalArgumentException("path must start with '/': " + path);
        }
        method = method.toUpperCase(Locale.ROOT);
    }

    public static ApiRequest get(String path) {
        return new ApiRequest("GET", path, null, false);
    }

    public static ApiRequest post(String path, Object body) {
        return new ApiRequest("POST", path, body, false);
    }

    public static ApiRequest put(String path, Object body) {
        return new ApiRequest("PUT", path, body, false);
    }

    public static ApiRequest delete(String path) {
        return new ApiRequest("DELETE", path, null, false);
    }

    public ApiRequest markRetried() {
        return retried ? this : new ApiRequest(method, path, body, true);
    }

    @Override
    public String toString() {
        return method + " " + path + (retried ? " (retry)" : "");
    }
}

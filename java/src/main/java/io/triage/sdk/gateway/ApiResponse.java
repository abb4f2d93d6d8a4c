package io.triage.sdk.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import io.triage.sdk.TriageException;
import io.triage.sdk.internal.Json;

import java.io.IOException;

/**
 * Completed gateway response with the raw body retained for decoding.
 */
public final class ApiResponse {

    private final int statusCode;
    private final byte[] body;

    public ApiResponse(int statusCode, byte[] body) {
        this.statusCode = statusCode;
        this.body = body == null ? new byte[0] : body;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public byte[] getBody() {
        return body.clone();
    }

    public JsonNode json() throws TriageException {
        try {
            return Json.tree(body);
        } catch (IOException ex) {
            throw new TriageException("decode response: " + ex.getMessage(), ex);
        }
    }

    public <T> T as(Class<T> type) throws TriageException {
        try {
            return Json.mapper().readValue(body, type);
        } catch (IOException ex) {
            throw new TriageException("decode " + type.getSimpleName() + " response: " + ex.getMessage(), ex);
        }
    }
}

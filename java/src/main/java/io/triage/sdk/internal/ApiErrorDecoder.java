package io.triage.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import io.triage.sdk.TriageApiException;
import io.triage.sdk.gateway.FailureKind;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding error payloads from the Triage API gateway.
 *
 * <p>Understands the {@code {"code", "message"}} envelope as well as the {@code {"detail": ...}} body produced by the
 * FastAPI services behind the gateway, where {@code detail} is either a string or a list of validation errors.</p>
 */
public final class ApiErrorDecoder {

    private ApiErrorDecoder() {
    }

    public static TriageApiException decode(int statusCode, byte[] body, FailureKind kind) {
        if (body == null || body.length == 0) {
            return new TriageApiException(statusCode, null, null, kind);
        }

        try {
            JsonNode node = Json.mapper().readTree(body);
            String code = node.hasNonNull("code") ? node.get("code").asText() : null;
            String message = node.hasNonNull("message") ? node.get("message").asText() : detail(node.path("detail"));
            return new TriageApiException(statusCode, code, message, kind);
        } catch (IOException ex) {
            String fallback = new String(body, StandardCharsets.UTF_8);
            return new TriageApiException(statusCode, null, fallback, kind);
        }
    }

    private static String detail(JsonNode detail) {
        if (detail.isTextual()) {
            return detail.asText();
        }
        if (detail.isArray() && detail.size() > 0) {
            JsonNode first = detail.get(0);
            return first.hasNonNull("msg") ? first.get("msg").asText() : first.toString();
        }
        return null;
    }
}

package io.triage.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Centralised ObjectMapper configuration. The gateway speaks snake_case, so records map
 * {@code fullName} to {@code full_name} without per-field annotations.
 */
public final class Json {

    private static final byte[] EMPTY_OBJECT = "{}".getBytes(StandardCharsets.UTF_8);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Parses a response body, treating an empty body as an empty object.
     */
    public static JsonNode tree(byte[] body) throws IOException {
        if (body == null || body.length == 0) {
            return MAPPER.readTree(EMPTY_OBJECT);
        }
        return MAPPER.readTree(body);
    }

    public static byte[] bytes(Object payload) throws IOException {
        return MAPPER.writeValueAsBytes(payload);
    }
}

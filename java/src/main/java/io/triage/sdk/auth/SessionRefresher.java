package io.triage.sdk.auth;

import com.fasterxml.jackson.databind.JsonNode;
import io.triage.sdk.TriageException;
import io.triage.sdk.gateway.ApiRequest;
import io.triage.sdk.gateway.ApiResponse;
import io.triage.sdk.gateway.FailureClassifier;
import io.triage.sdk.gateway.HttpTransport;
import io.triage.sdk.gateway.RefreshOperation;
import io.triage.sdk.internal.ApiErrorDecoder;

import java.util.Objects;

/**
 * Calls the refresh endpoint. The refresh token travels in an httpOnly cookie handled by the HTTP client's cookie
 * manager; when the response also carries an {@code access_token} the store's token is rotated in place.
 */
public final class SessionRefresher implements RefreshOperation {

    public static final String REFRESH_PATH = "/api/v1/auth/refresh";

    private final HttpTransport transport;
    private final FailureClassifier classifier;
    private final CredentialStore store;

    public SessionRefresher(HttpTransport transport, FailureClassifier classifier, CredentialStore store) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.store = Objects.requireNonNull(store, "store");
    }

    @Override
    public void refresh() throws TriageException {
        ApiRequest request = ApiRequest.post(REFRESH_PATH, null);
        ApiResponse response = transport.execute(request);
        if (!response.isSuccessful()) {
            throw ApiErrorDecoder.decode(
                response.getStatusCode(),
                response.getBody(),
                classifier.classify(request, response.getStatusCode())
            );
        }

        JsonNode node = response.json();
        String token = node.path("access_token").asText("");
        if (!token.isBlank()) {
            store.replaceAccessToken(token);
        }
    }
}

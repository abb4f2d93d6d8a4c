package io.triage.sdk.gateway;

import io.triage.sdk.TriageException;
import io.triage.sdk.internal.ApiErrorDecoder;

import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point every application request goes through.
 *
 * <p>A request is sent with the current credential; a failure is classified once, where it is first observed. Only an
 * expired session on a request that has not been replayed yet is held back: it waits for the
 * {@link RefreshCoordinator} and is then replayed exactly once, carrying the retry marker. Every other failure is
 * returned to the caller as a {@link io.triage.sdk.TriageApiException} with its {@link FailureKind}.</p>
 */
public final class ApiGateway {

    private static final Logger LOGGER = Logger.getLogger(ApiGateway.class.getName());

    private final HttpTransport transport;
    private final FailureClassifier classifier;
    private final RefreshCoordinator coordinator;

    public ApiGateway(HttpTransport transport, FailureClassifier classifier, RefreshCoordinator coordinator) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
    }

    /**
     * Sends the request, transparently recovering from an expired session.
     *
     * @return the successful (2xx) response.
     * @throws io.triage.sdk.TriageApiException for non-2xx responses that are not recovered.
     * @throws io.triage.sdk.RefreshFailedException when recovery was attempted and the refresh failed.
     */
    public ApiResponse send(ApiRequest request) throws TriageException {
        Objects.requireNonNull(request, "request");
        ApiResponse response = transport.execute(request);
        if (response.isSuccessful()) {
            return response;
        }

        FailureKind kind = classifier.classify(request, response.getStatusCode());
        if (!kind.isRecoverable()) {
            throw ApiErrorDecoder.decode(response.getStatusCode(), response.getBody(), kind);
        }

        ApiRequest replay = request.markRetried();
        coordinator.awaitRefresh();
        LOGGER.fine(() -> "[triage-sdk] replaying " + replay);
        return send(replay);
    }
}

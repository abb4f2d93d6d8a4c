package io.triage.sdk.gateway;

import io.triage.sdk.TriageException;
import io.triage.sdk.auth.CredentialAttacher;
import io.triage.sdk.internal.HttpUtil;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Sends one {@link ApiRequest} with the current credential attached. No classification and no retries.
 */
public final class HttpTransport {

    private static final Logger LOGGER = Logger.getLogger(HttpTransport.class.getName());

    private final HttpClient httpClient;
    private final String baseUrl;
    private final Duration timeout;
    private final CredentialAttacher attacher;

    public HttpTransport(HttpClient httpClient, String baseUrl, Duration timeout, CredentialAttacher attacher) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        this.timeout = timeout;
        this.attacher = Objects.requireNonNull(attacher, "attacher");
    }

    public ApiResponse execute(ApiRequest request) throws TriageException {
        LOGGER.fine(() -> "[triage-sdk] " + request);
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.sendJson(
                httpClient,
                request.method(),
                baseUrl + request.path(),
                request.body(),
                attacher.bearerToken(),
                timeout
            );
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TriageException(request + " interrupted", ex);
        } catch (IOException ex) {
            throw new TriageException(request + ": " + ex.getMessage(), ex);
        }
        int status = response.statusCode();
        LOGGER.fine(() -> "[triage-sdk] " + request + " -> " + status);
        return new ApiResponse(status, response.body());
    }

    public String getBaseUrl() {
        return baseUrl;
    }
}

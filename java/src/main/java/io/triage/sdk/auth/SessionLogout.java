package io.triage.sdk.auth;

import io.triage.sdk.TriageException;
import io.triage.sdk.gateway.ApiRequest;
import io.triage.sdk.gateway.ApiResponse;
import io.triage.sdk.gateway.HttpTransport;
import io.triage.sdk.session.SessionTeardown;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ends the session on both sides: asks the gateway to drop its session and cookies, then tears the local session
 * down. The remote call goes straight to the transport, so its outcome never triggers a refresh, and it is
 * best-effort: the local session ends even when it fails.
 */
public final class SessionLogout {

    private static final Logger LOGGER = Logger.getLogger(SessionLogout.class.getName());

    public static final String LOGOUT_PATH = "/api/v1/auth/logout";

    private final HttpTransport transport;
    private final SessionTeardown teardown;

    public SessionLogout(HttpTransport transport, SessionTeardown teardown) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.teardown = Objects.requireNonNull(teardown, "teardown");
    }

    public void logout() {
        try {
            ApiResponse response = transport.execute(ApiRequest.post(LOGOUT_PATH, null));
            if (!response.isSuccessful()) {
                LOGGER.warning(() -> "[triage-sdk] logout endpoint returned " + response.getStatusCode());
            }
        } catch (TriageException | RuntimeException ex) {
            LOGGER.log(Level.WARNING, "[triage-sdk] logout request failed", ex);
        } finally {
            teardown.teardown();
        }
    }
}

package io.triage.sdk.gateway;

/**
 * Classification of a failed request.
 */
public enum FailureKind {

    /**
     * The session expired; recoverable through a refresh. Never surfaced to callers.
     */
    SESSION_EXPIRED,

    /**
     * Failure on an auth endpoint (login, registration, refresh), e.g. bad credentials.
     */
    AUTH_ENDPOINT_FAILURE,

    /**
     * The refresh operation failed; the session has been torn down.
     */
    REFRESH_FAILED,

    /**
     * A request that was already replayed once failed with an expired session again.
     */
    RETRY_EXHAUSTED,

    /**
     * Anything else; passed through untouched.
     */
    OTHER_FAILURE;

    public boolean isRecoverable() {
        return this == SESSION_EXPIRED;
    }
}

package io.triage.sdk;

import io.triage.sdk.gateway.FailureKind;

/**
 * Raised for every request that was waiting on a session refresh that did not succeed. The session has been torn
 * down by the time callers observe this exception.
 */
public final class RefreshFailedException extends TriageException {

    private static final long serialVersionUID = 1L;

    public RefreshFailedException(String message, Throwable cause) {
        super(message, cause, FailureKind.REFRESH_FAILED);
    }
}

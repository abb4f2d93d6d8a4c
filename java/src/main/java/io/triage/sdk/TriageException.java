package io.triage.sdk;

import io.triage.sdk.gateway.FailureKind;

/**
 * Base exception thrown by the Triage Java SDK.
 */
public class TriageException extends Exception {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public TriageException(String message) {
        this(message, null, FailureKind.OTHER_FAILURE);
    }

    public TriageException(String message, Throwable cause) {
        this(message, cause, FailureKind.OTHER_FAILURE);
    }

    protected TriageException(String message, Throwable cause, FailureKind kind) {
        super(message, cause);
        this.kind = kind == null ? FailureKind.OTHER_FAILURE : kind;
    }

    /**
     * @return how the coordinator classified the failure that produced this exception.
     */
    public FailureKind getKind() {
        return kind;
    }
}

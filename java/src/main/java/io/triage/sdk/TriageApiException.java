package io.triage.sdk;

import io.triage.sdk.gateway.FailureKind;

/**
 * Exception representing an error returned by the Triage API gateway. When the backend responds with a non-2xx status
 * the SDK hydrates this type so callers can inspect the HTTP status, the error code and the failure classification.
 */
public class TriageApiException extends TriageException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public TriageApiException(int statusCode, String code, String message) {
        this(statusCode, code, message, FailureKind.OTHER_FAILURE);
    }

    public TriageApiException(int statusCode, String code, String message, FailureKind kind) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message, null, kind);
        this.statusCode = statusCode;
        this.code = code;
    }

    /**
     * @return HTTP status code returned by the gateway.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "Triage request failed with status " + status;
        }
        return "Triage request failed with status " + status + " (" + code + ")";
    }
}
